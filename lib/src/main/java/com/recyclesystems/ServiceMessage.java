package com.recyclesystems;

import java.util.Arrays;

/**
 * Messages a service's processing loop understands. Each carries the reply
 * slot on which exactly one {@link Result} is delivered.
 *
 * @param <C> the configuration type of the service
 */
public sealed interface ServiceMessage<C> permits ServiceMessage.Start, ServiceMessage.Stop, ServiceMessage.Receive {

    ReplySlot<Object> reply();

    /**
     * Start the service with the given configuration.
     */
    record Start<C>(C config, ReplySlot<Object> reply) implements ServiceMessage<C> {}

    /**
     * Stop the service.
     */
    record Stop<C>(ReplySlot<Object> reply) implements ServiceMessage<C> {}

    /**
     * Invoke the receive function of a running service.
     */
    record Receive<C>(Object[] args, ReplySlot<Object> reply) implements ServiceMessage<C> {
        public Receive {
            args = args == null ? new Object[0] : args.clone();
        }

        @Override
        public Object[] args() {
            return args.clone();
        }

        @Override
        public String toString() {
            return "Receive[args=" + Arrays.toString(args) + "]";
        }
    }
}
