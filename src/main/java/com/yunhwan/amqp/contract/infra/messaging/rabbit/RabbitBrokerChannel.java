package com.yunhwan.amqp.contract.infra.messaging.rabbit;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.yunhwan.amqp.contract.common.exception.BrokerOperationException;
import com.yunhwan.amqp.contract.domain.consumer.DeliveryEnvelope;
import com.yunhwan.amqp.contract.domain.topology.ExchangeBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.ExchangeDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueBindingDefinition;
import com.yunhwan.amqp.contract.domain.topology.QueueDefinition;
import com.yunhwan.amqp.contract.usecase.consumer.port.BrokerChannel;
import com.yunhwan.amqp.contract.usecase.consumer.port.DeliveryCallback;
import com.yunhwan.amqp.contract.usecase.consumer.port.OutboundMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ Java client {@link Channel} 위의 BrokerChannel 구현.
 * <p>
 * 채널 하나를 여러 consumer가 공유하므로 ack/reject/publish/선언은 직렬화한다.
 * 브로커의 consumer cancel 통지는 null 전달로 콜백에 넘긴다.
 */
@Slf4j
public class RabbitBrokerChannel implements BrokerChannel {

    private static final int PERSISTENT_DELIVERY_MODE = 2;
    private static final int TRANSIENT_DELIVERY_MODE = 1;

    private final Channel channel;
    private final Connection connection;
    private final Object lock = new Object();

    public RabbitBrokerChannel(Channel channel) {
        this(channel, null);
    }

    private RabbitBrokerChannel(Channel channel, Connection connection) {
        this.channel = channel;
        this.connection = connection;
    }

    /**
     * Spring AMQP ConnectionFactory에서 채널을 연다. 반환된 객체는 연결을 소유한다.
     */
    public static RabbitBrokerChannel open(ConnectionFactory connectionFactory) {
        Connection connection = connectionFactory.createConnection();
        return new RabbitBrokerChannel(connection.createChannel(false), connection);
    }

    @Override
    public void declareExchange(ExchangeDefinition exchange) {
        synchronized (lock) {
            try {
                channel.exchangeDeclare(exchange.name(), exchange.type().amqpName(), exchange.durable(),
                        exchange.autoDelete(), exchange.internal(), exchange.arguments());
            } catch (IOException e) {
                throw new BrokerOperationException("exchange declare failed. exchange=" + exchange.name(), e);
            }
        }
    }

    @Override
    public void declareQueue(QueueDefinition queue) {
        synchronized (lock) {
            try {
                channel.queueDeclare(queue.getName(), queue.isDurable(), queue.isExclusive(),
                        queue.isAutoDelete(), RabbitQueueArguments.of(queue));
            } catch (IOException e) {
                throw new BrokerOperationException("queue declare failed. queue=" + queue.getName(), e);
            }
        }
    }

    @Override
    public void bindQueue(QueueBindingDefinition binding) {
        synchronized (lock) {
            try {
                channel.queueBind(binding.queue().getName(), binding.exchange().name(),
                        binding.routingKey(), binding.arguments());
            } catch (IOException e) {
                throw new BrokerOperationException("queue bind failed. queue=" + binding.queue().getName()
                        + ", exchange=" + binding.exchange().name(), e);
            }
        }
    }

    @Override
    public void bindExchange(ExchangeBindingDefinition binding) {
        synchronized (lock) {
            try {
                channel.exchangeBind(binding.destination().name(), binding.source().name(),
                        binding.routingKey(), binding.arguments());
            } catch (IOException e) {
                throw new BrokerOperationException("exchange bind failed. destination=" + binding.destination().name()
                        + ", source=" + binding.source().name(), e);
            }
        }
    }

    @Override
    public void setPrefetch(int prefetch) {
        synchronized (lock) {
            try {
                // global=false: 이후 basicConsume하는 consumer 단위 제한
                channel.basicQos(prefetch, false);
            } catch (IOException e) {
                throw new BrokerOperationException("basicQos failed. prefetch=" + prefetch, e);
            }
        }
    }

    @Override
    public String subscribe(String queueName, DeliveryCallback callback) {
        synchronized (lock) {
            try {
                return channel.basicConsume(queueName, false, new CallbackConsumer(channel, queueName, callback));
            } catch (IOException e) {
                throw new BrokerOperationException("basicConsume failed. queue=" + queueName, e);
            }
        }
    }

    @Override
    public void cancel(String consumerTag) {
        synchronized (lock) {
            try {
                channel.basicCancel(consumerTag);
            } catch (IOException e) {
                throw new BrokerOperationException("basicCancel failed. consumerTag=" + consumerTag, e);
            }
        }
    }

    @Override
    public void ack(long deliveryTag) {
        synchronized (lock) {
            try {
                channel.basicAck(deliveryTag, false);
            } catch (IOException e) {
                throw new BrokerOperationException("basicAck failed. deliveryTag=" + deliveryTag, e);
            }
        }
    }

    @Override
    public void reject(long deliveryTag, boolean requeue) {
        synchronized (lock) {
            try {
                channel.basicReject(deliveryTag, requeue);
            } catch (IOException e) {
                throw new BrokerOperationException("basicReject failed. deliveryTag=" + deliveryTag
                        + ", requeue=" + requeue, e);
            }
        }
    }

    @Override
    public void publish(String exchange, String routingKey, OutboundMessage message) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .headers(new LinkedHashMap<>(message.headers()))
                .contentType(message.contentType())
                .contentEncoding(message.contentEncoding())
                .messageId(message.messageId())
                .correlationId(message.correlationId())
                .priority(message.priority())
                .deliveryMode(message.persistent() ? PERSISTENT_DELIVERY_MODE : TRANSIENT_DELIVERY_MODE)
                .expiration(message.expiration())
                .build();
        synchronized (lock) {
            try {
                channel.basicPublish(exchange, routingKey, props, message.body());
            } catch (IOException e) {
                throw new BrokerOperationException("basicPublish failed. exchange=" + exchange
                        + ", routingKey=" + routingKey, e);
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            try {
                if (channel.isOpen()) {
                    channel.close();
                }
            } catch (IOException | TimeoutException e) {
                throw new BrokerOperationException("channel close failed", e);
            } finally {
                if (connection != null) {
                    connection.close();
                }
            }
        }
    }

    static DeliveryEnvelope toEnvelope(String consumerTag, Envelope envelope, AMQP.BasicProperties props, byte[] body) {
        return DeliveryEnvelope.builder()
                .deliveryTag(envelope.getDeliveryTag())
                .consumerTag(consumerTag)
                .exchange(envelope.getExchange())
                .routingKey(envelope.getRoutingKey())
                .redelivered(envelope.isRedeliver())
                .body(body)
                .headers(plainHeaders(props == null ? null : props.getHeaders()))
                .contentType(props == null ? null : props.getContentType())
                .contentEncoding(props == null ? null : props.getContentEncoding())
                .messageId(props == null ? null : props.getMessageId())
                .correlationId(props == null ? null : props.getCorrelationId())
                .priority(props == null ? null : props.getPriority())
                .persistent(props != null && props.getDeliveryMode() != null
                        && props.getDeliveryMode() == PERSISTENT_DELIVERY_MODE)
                .build();
    }

    /**
     * 클라이언트가 문자열 헤더를 LongString으로 넘기므로 String으로 바꾼다.
     */
    static Map<String, Object> plainHeaders(Map<String, Object> headers) {
        if (headers == null) {
            return Map.of();
        }
        Map<String, Object> plain = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (v == null) {
                return;
            }
            plain.put(k, v instanceof LongString ls ? ls.toString() : v);
        });
        return plain;
    }

    private static final class CallbackConsumer extends DefaultConsumer {

        private final String queueName;
        private final DeliveryCallback callback;

        private CallbackConsumer(Channel channel, String queueName, DeliveryCallback callback) {
            super(channel);
            this.queueName = queueName;
            this.callback = callback;
        }

        @Override
        public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            try {
                callback.onDelivery(toEnvelope(consumerTag, envelope, properties, body));
            } catch (RuntimeException | Error e) {
                // 클라이언트 dispatch 스레드로 예외를 올리면 채널이 닫힌다
                log.error("[RabbitBrokerChannel] delivery callback failed. queue={}, deliveryTag={}",
                        queueName, envelope.getDeliveryTag(), e);
            }
        }

        @Override
        public void handleCancel(String consumerTag) {
            log.warn("[RabbitBrokerChannel] consumer cancelled by broker. queue={}, consumerTag={}", queueName, consumerTag);
            callback.onDelivery(null);
        }
    }
}
