package net.spookly.shunt.resolve;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import io.netty.buffer.ByteBuf;
import io.netty.channel.EventLoop;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DefaultDnsRecordDecoder;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Future;

/**
 * {@link DnsLookup} backed by Netty's asynchronous DNS resolver.
 */
public final class NettyDnsLookup implements DnsLookup {
    private final DnsNameResolver resolver;

    /**
     * Create a resolver bound to an event loop, using the system name servers.
     */
    public NettyDnsLookup(EventLoop eventLoop, long queryTimeoutMs) {
        Objects.requireNonNull(eventLoop, "eventLoop");
        this.resolver = new DnsNameResolverBuilder(eventLoop)
                .channelType(NioDatagramChannel.class)
                .queryTimeoutMillis(queryTimeoutMs)
                .build();
    }

    @Override
    public CompletableFuture<List<InetAddress>> lookupHost(String host) {
        CompletableFuture<List<InetAddress>> result = new CompletableFuture<>();
        resolver.resolveAll(host).addListener((Future<List<InetAddress>> future) -> {
            if (future.isSuccess()) {
                result.complete(List.copyOf(future.getNow()));
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<List<SrvRecord>> lookupSrv(String name) {
        CompletableFuture<List<SrvRecord>> result = new CompletableFuture<>();
        resolver.resolveAll(new DefaultDnsQuestion(name, DnsRecordType.SRV))
                .addListener((Future<List<DnsRecord>> future) -> {
                    if (!future.isSuccess()) {
                        result.completeExceptionally(future.cause());
                        return;
                    }
                    List<DnsRecord> answers = future.getNow();
                    try {
                        result.complete(decodeSrv(answers));
                    } catch (RuntimeException e) {
                        result.completeExceptionally(e);
                    } finally {
                        for (DnsRecord answer : answers) {
                            ReferenceCountUtil.release(answer);
                        }
                    }
                });
        return result;
    }

    private static List<SrvRecord> decodeSrv(List<DnsRecord> answers) {
        List<SrvRecord> records = new ArrayList<>(answers.size());
        for (DnsRecord answer : answers) {
            if (answer.type() != DnsRecordType.SRV || !(answer instanceof DnsRawRecord)) {
                continue;
            }
            // RDATA: priority, weight, port, then a possibly compressed target name.
            ByteBuf content = ((DnsRawRecord) answer).content().duplicate();
            int priority = content.readUnsignedShort();
            int weight = content.readUnsignedShort();
            int port = content.readUnsignedShort();
            String target = DefaultDnsRecordDecoder.decodeName(content);
            records.add(new SrvRecord(priority, weight, port, target));
        }
        return records;
    }

    @Override
    public void close() {
        resolver.close();
    }
}
