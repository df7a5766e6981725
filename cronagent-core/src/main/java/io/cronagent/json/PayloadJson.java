package io.cronagent.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.cronagent.core.JobPayload;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PayloadJson(
        String kind,
        String message,
        String command,
        boolean deliver,
        String channel,
        String to
) {

    public static PayloadJson from(JobPayload payload) {
        return new PayloadJson(payload.kind(), payload.message(), payload.command(),
                payload.deliver(), payload.channel(), payload.to());
    }

    public JobPayload toPayload() {
        return new JobPayload(kind, message, command, deliver, channel, to);
    }
}
