package io.docanalytics.transport;

/**
 * RabbitMQ names shared by every service. Each can be overridden through an environment variable
 * or system property of the same name.
 */
public final class Topology {

    /** Direct exchange carrying topic broadcasts; the routing key is the topic name. */
    public static final String BROADCAST_EXCHANGE = cfg("DOCANALYTICS_BROADCAST_EXCHANGE", "docanalytics.topics");

    /** Direct exchange for {@code get_metrics} requests; the routing key is the topic name. */
    public static final String METRICS_EXCHANGE = cfg("DOCANALYTICS_METRICS_EXCHANGE", "docanalytics.metrics");

    /** Header repeating the topic frame of a broadcast. */
    public static final String TOPIC_HEADER = "x-topic";

    private Topology() {
    }

    private static String cfg(String key, String def) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) {
            v = System.getProperty(key);
        }
        return (v == null || v.isBlank()) ? def : v;
    }
}
