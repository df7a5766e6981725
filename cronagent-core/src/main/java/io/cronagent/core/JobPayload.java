package io.cronagent.core;

/**
 * What a job asks the action runtime to do. Opaque to the scheduler beyond validation; handed
 * to {@link io.cronagent.ActionRuntime} verbatim.
 *
 * @param kind    runtime-defined action kind; blank becomes {@value #DEFAULT_KIND}
 * @param message message text for the runtime (required)
 * @param command optional command to run alongside the message
 * @param deliver whether the runtime should deliver its response over {@code channel}
 * @param channel delivery channel (e.g. "telegram", "slack"); required when {@code deliver}
 * @param to      recipient on the channel
 */
public record JobPayload(
        String kind,
        String message,
        String command,
        boolean deliver,
        String channel,
        String to
) {

    public static final String DEFAULT_KIND = "agent_turn";

    public JobPayload {
        kind = (kind == null || kind.isBlank()) ? DEFAULT_KIND : kind.trim();
        if (message == null || message.isBlank()) {
            throw new InvalidPayloadException("payload.message is required");
        }
        command = blankToNull(command);
        channel = blankToNull(channel);
        to = blankToNull(to);
        if (deliver && channel == null) {
            throw new InvalidPayloadException("payload.channel is required when payload.deliver is true");
        }
    }

    public static JobPayload message(String message) {
        return new JobPayload(DEFAULT_KIND, message, null, false, null, null);
    }

    public static JobPayload delivered(String message, String channel, String to) {
        return new JobPayload(DEFAULT_KIND, message, null, true, channel, to);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
