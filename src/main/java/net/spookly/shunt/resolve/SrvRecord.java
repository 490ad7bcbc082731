package net.spookly.shunt.resolve;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * One DNS SRV answer.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@ToString
public final class SrvRecord {
    private final int priority;
    private final int weight;
    private final int port;
    private final String target;
}
