package io.cronagent.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronagent.core.CronSchedule;
import io.cronagent.core.EverySchedule;
import io.cronagent.core.InvalidPayloadException;
import io.cronagent.core.InvalidScheduleException;
import io.cronagent.core.JobDraft;
import io.cronagent.core.JobPatch;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void draftShouldApplyCreationDefaults() throws Exception {
        JobJson json = objectMapper.readValue("""
                {"name":"digest","schedule":{"kind":"cron","expr":"0 8 * * 1-5","tz":"Europe/Berlin"},
                 "payload":{"message":"summarize"},"unknownField":true}
                """, JobJson.class);

        JobDraft draft = json.toDraft();

        assertThat(draft.enabled()).isTrue();
        assertThat(draft.deleteAfterRun()).isFalse();
        assertThat(draft.schedule()).isEqualTo(new CronSchedule("0 8 * * 1-5", "Europe/Berlin"));
        assertThat(draft.payload().kind()).isEqualTo("agent_turn");
        assertThat(draft.payload().deliver()).isFalse();
    }

    @Test
    void patchShouldOnlyCarryPresentFields() throws Exception {
        JobJson json = objectMapper.readValue("""
                {"id":"j1","schedule":{"kind":"every","everyMs":60000}}
                """, JobJson.class);

        JobPatch patch = json.toPatch();

        assertThat(patch.name()).isNull();
        assertThat(patch.enabled()).isNull();
        assertThat(patch.payload()).isNull();
        assertThat(patch.schedule()).isEqualTo(new EverySchedule(Duration.ofMinutes(1)));
    }

    @Test
    void malformedScheduleShouldBeRejected() throws Exception {
        JobJson unknownKind = objectMapper.readValue("""
                {"schedule":{"kind":"hourly"},"payload":{"message":"m"}}
                """, JobJson.class);
        JobJson missingInterval = objectMapper.readValue("""
                {"schedule":{"kind":"every"},"payload":{"message":"m"}}
                """, JobJson.class);
        JobJson badZone = objectMapper.readValue("""
                {"schedule":{"kind":"cron","expr":"* * * * *","tz":"Mars/Olympus"},"payload":{"message":"m"}}
                """, JobJson.class);

        assertThatThrownBy(unknownKind::toDraft).isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(missingInterval::toDraft).isInstanceOf(InvalidScheduleException.class);
        assertThatThrownBy(badZone::toDraft).isInstanceOf(InvalidScheduleException.class);
    }

    @Test
    void deliveryWithoutChannelShouldBeRejected() throws Exception {
        JobJson json = objectMapper.readValue("""
                {"schedule":{"kind":"every","everyMs":1000},"payload":{"message":"m","deliver":true}}
                """, JobJson.class);

        assertThatThrownBy(json::toDraft)
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("channel");
    }
}
