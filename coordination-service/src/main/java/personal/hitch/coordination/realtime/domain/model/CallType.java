package personal.hitch.coordination.realtime.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 통화 종류 (voice, video)
 */
public enum CallType {
    VOICE("voice"),
    VIDEO("video");

    private final String wireName;

    CallType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<CallType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equalsIgnoreCase(wireName))
                .findFirst();
    }
}
