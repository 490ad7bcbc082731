package net.spookly.shunt.resolve;

import java.net.InetSocketAddress;

import io.netty.util.NetUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Concrete IP and port produced from a textual address.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
@ToString
public final class ResolvedEndpoint {
    private final String ip;
    private final int port;
    private final String originalInput;
    /**
     * Host name the address came from: the input host, or the SRV target when one was used.
     */
    private final String resolvedHost;

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(NetUtil.createInetAddressFromIpAddressString(ip), port);
    }
}
