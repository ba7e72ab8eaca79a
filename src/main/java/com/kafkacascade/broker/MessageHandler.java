package com.kafkacascade.broker;

import com.kafkacascade.model.CascadeMessage;

import java.util.concurrent.CompletionStage;

@FunctionalInterface
public interface MessageHandler {

    CompletionStage<Void> handle(CascadeMessage message);
}
