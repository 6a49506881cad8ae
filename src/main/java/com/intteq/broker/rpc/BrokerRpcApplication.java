package com.intteq.broker.rpc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the RPC worker process.
 *
 * <p>The same binary runs the worker ({@code rpc.worker.enabled}, on by default) and,
 * when {@code rpc.client.enabled=true}, the client side with its reply listener.
 */
@SpringBootApplication
public class BrokerRpcApplication {

    public static void main(String[] args) {
        SpringApplication.run(BrokerRpcApplication.class, args);
    }
}
