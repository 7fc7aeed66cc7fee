package info.acme.ordering.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class KafkaConfig {
    @Value("${app.kafka.orders-finalized-topic}")
    private String ordersFinalizedTopic;

    @Value("${app.kafka.partitions:1}")
    private int partitions;

    @Value("${app.kafka.replicas:1}")
    private int replicas;

    /**
     * Declares the topic that receives finalized orders. The admin client
     * creates it on startup when it does not exist yet.
     *
     * @return The topic definition.
     */
    @Bean
    public NewTopic ordersFinalizedTopic() {
        log.info("Declaring Kafka topic {} with {} partition(s) and {} replica(s)", ordersFinalizedTopic,
                partitions, replicas);

        return TopicBuilder.name(ordersFinalizedTopic)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}
