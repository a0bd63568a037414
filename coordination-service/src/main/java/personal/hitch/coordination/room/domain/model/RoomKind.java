package personal.hitch.coordination.room.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Room 종류
 * 와이어 표현 접두어(ride, package, group, call)를 함께 관리
 */
public enum RoomKind {
    RIDE("ride"),
    PACKAGE("package"),
    GROUP("group"),
    CALL("call");

    private final String prefix;

    RoomKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public static Optional<RoomKind> fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(kind -> kind.prefix.equalsIgnoreCase(prefix))
                .findFirst();
    }
}
