package com.abba.rxreminder.domain.service;

public interface SmsGateway {

    /**
     * Sends a text message.
     *
     * @param to   recipient in E.164 format
     * @param body message text
     * @return the provider's delivery id
     * @throws com.abba.rxreminder.domain.exception.DeliveryException if the provider rejects the message
     */
    String send(String to, String body);
}
