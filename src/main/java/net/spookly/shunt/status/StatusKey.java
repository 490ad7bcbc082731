package net.spookly.shunt.status;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Everything a rendered status payload depends on.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class StatusKey {
    private final String motd;
    private final int protocolVersion;
    private final long playerCount;
}
