package com.psyos.pipeline.infrastructure;

/**
 * Names of the three durable job queues (Kafka topics).
 */
public final class JobTopics {

    public static final String INBOUND = "inbound";
    public static final String AI_REPLY = "ai-reply";
    public static final String OUTBOUND = "outbound";

    public static final String JOB_ID_HEADER = "x-job-id";

    private JobTopics() {
    }
}
