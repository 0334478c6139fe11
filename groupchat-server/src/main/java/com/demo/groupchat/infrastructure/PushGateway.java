package com.demo.groupchat.infrastructure;

/**
 * Push provider. Each fan-out opens its own session and closes it when done.
 */
public interface PushGateway {

    PushSession openSession();
}
