package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.InboundJob;
import com.psyos.pipeline.domain.OutboundJob;

/**
 * Enqueue into the pipeline's work queues. Returns the job id once the queue has accepted
 * the job; callers never wait for it to be processed.
 *
 * @throws com.psyos.pipeline.exception.JobEnqueueException from every method when the queue
 *         did not accept the job
 */
public interface JobQueue {

    String enqueueInbound(InboundJob job);

    String enqueueAiReply(AiReplyJob job);

    String enqueueOutbound(OutboundJob job);
}
