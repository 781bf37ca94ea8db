package com.flapmyport.plugins.snmp;

import com.flapmyport.core.model.Oids;
import com.flapmyport.core.model.TrapNotification;
import com.flapmyport.core.model.VarBind;
import com.flapmyport.core.spi.ProtocolDriver;
import com.flapmyport.core.spi.TrapListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snmp4j.CommandResponder;
import org.snmp4j.CommandResponderEvent;
import org.snmp4j.PDU;
import org.snmp4j.PDUv1;
import org.snmp4j.Snmp;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * UDP trap receiver (SNMP v1/v2c, community model).
 * <p>
 * v1 traps are translated to the v2 layout (RFC 3584 section 3.1): sysUpTime.0 and snmpTrapOID.0
 * come first, so linkDown/linkUp look the same whatever the version.
 * <p>
 * The SNMP4J listen thread only copies each PDU into a {@link TrapNotification} and offers it to
 * a bounded queue; a fixed pool of workers drains the queue and calls the listener. The pool
 * size is therefore the number of traps handled at once, and the queue absorbs bursts.
 */
public class SnmpTrapDriver implements CommandResponder, ProtocolDriver {
    private static final Logger log = LoggerFactory.getLogger(SnmpTrapDriver.class);

    // --- Config
    private final String address;
    private final int port;

    private final int queueCapacity;
    private final int workerThreads;
    public enum OverflowPolicy { BLOCK, DROP_NEWEST }

    private static final String SNMP_TRAPS = "1.3.6.1.6.3.1.1.5";
    private final OverflowPolicy overflowPolicy;
    private final long offerTimeoutMillis;
    private final int udpReceiveBufferBytes;
    private final int maxInboundMessageSize;

    // --- Runtime
    private volatile TrapListener listener = t -> {};
    private volatile boolean running;

    private DefaultUdpTransportMapping transport;
    private Snmp snmp;

    private final BlockingQueue<TrapNotification> queue;
    private ExecutorService workersPool;

    private final AtomicLong enqueued  = new AtomicLong();
    private final AtomicLong dropped   = new AtomicLong();
    private final AtomicLong processed = new AtomicLong();

    // --- Ctors
    public SnmpTrapDriver(String address, int port) {
        this(address, port,
                4096,
                4,
                OverflowPolicy.BLOCK, 5, TimeUnit.MILLISECONDS,
                4 * 1024 * 1024,
                64 * 1024);
    }

    public SnmpTrapDriver(
            String address,
            int port,
            int queueCapacity,
            int workerThreads,
            OverflowPolicy overflowPolicy,
            long offerTimeout,
            TimeUnit offerTimeoutUnit,
            int udpReceiveBufferBytes,
            int maxInboundMessageSize
    ) {
        if (queueCapacity < 1) throw new IllegalArgumentException("queueCapacity must be >= 1");
        if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be >= 1");
        this.address = address;
        this.port = port;
        this.queueCapacity = queueCapacity;
        this.workerThreads = workerThreads;
        this.overflowPolicy = overflowPolicy;
        this.offerTimeoutMillis = offerTimeoutUnit.toMillis(offerTimeout);
        this.udpReceiveBufferBytes = udpReceiveBufferBytes;
        this.maxInboundMessageSize = maxInboundMessageSize;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
    }

    @Override
    public void setListener(TrapListener l) { this.listener = (l != null) ? l : (t -> {}); }

    // --- Lifecycle
    @Override
    public void start() throws Exception {
        UdpAddress addr = new UdpAddress(address + "/" + port);

        transport = new DefaultUdpTransportMapping(addr, /*reuseAddress=*/true);
        // must be set before listen()
        transport.setReceiveBufferSize(udpReceiveBufferBytes);
        transport.setMaxInboundMessageSize(maxInboundMessageSize);
        transport.setSocketTimeout(0);

        snmp = new Snmp(transport);
        snmp.addCommandResponder(this);
        running = true;
        snmp.listen();

        log.info("[start] binding udp/{} @ {} workers={} qCap={} overflow={} askRCVBUF={}KB maxIn={}",
                port, transport.getListenAddress(), workerThreads, queueCapacity, overflowPolicy,
                udpReceiveBufferBytes / 1024, maxInboundMessageSize);

        workersPool = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "trap-worker");
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerThreads; i++) workersPool.submit(this::workerLoop);
    }

    /**
     * Stops receiving. A trap already being handled finishes on its worker (up to
     * {@code drainTimeoutMillis}); traps still queued are discarded.
     */
    public void stop(long drainTimeoutMillis) {
        running = false;
        try {
            if (snmp != null) snmp.close();
        } catch (Exception e) {
            log.warn("[stop] error closing SNMP session: {}", e.toString());
        }
        if (workersPool != null) {
            workersPool.shutdown();
            try {
                if (!workersPool.awaitTermination(drainTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    workersPool.shutdownNow();
                }
            } catch (InterruptedException ie) {
                workersPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        int discarded = queue.size();
        queue.clear();
        log.info("[stop] processed={} enqueued={} dropped={} discarded={}",
                processed.get(), enqueued.get(), dropped.get(), discarded);
    }

    @Override
    public void close() {
        stop(5_000);
    }

    // --- Receiver -> queue
    @Override
    public void processPdu(CommandResponderEvent e) {
        try {
            if (e == null || e.getPDU() == null || e.getPeerAddress() == null) return;
            UdpAddress peer = (UdpAddress) e.getPeerAddress();
            PDU pdu = e.getPDU();

            List<VarBind> vbs = new ArrayList<>(Math.max(4, pdu.size() + 2));
            if (pdu instanceof PDUv1 v1) {
                vbs.add(new VarBind(Oids.SYS_UPTIME, v1.getTimestamp()));
                vbs.add(new VarBind(Oids.SNMP_TRAP_OID, v2TrapOid(v1)));
            }
            for (VariableBinding vb : pdu.getVariableBindings()) {
                if (vb != null && vb.getOid() != null && vb.getVariable() != null) {
                    vbs.add(new VarBind(vb.getOid().toDottedString(), VariableDecoder.decode(vb.getVariable())));
                }
            }

            TrapNotification trap = new TrapNotification(
                    peer.getInetAddress().getHostAddress(), peer.getPort(), PDU.getTypeString(pdu.getType()), vbs);

            boolean ok = (overflowPolicy == OverflowPolicy.BLOCK)
                    ? queue.offer(trap, offerTimeoutMillis, TimeUnit.MILLISECONDS)
                    : queue.offer(trap);

            if (ok) {
                enqueued.incrementAndGet();
                log.debug("[received] SNMP trap from {}:{} (PDU type: {}, {} varbinds)",
                        trap.sourceAddress(), trap.sourcePort(), trap.pduType(), vbs.size());
            } else {
                long total = dropped.incrementAndGet();
                if (total % 1000 == 1)
                    log.warn("[drop] queue full cap={} totalDropped={}", queueCapacity, total);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException ex) {
            log.error("[error] processPdu {}", ex.toString(), ex);
        }
    }

    /** snmpTrapOID.0 value for a v1 trap: snmpTraps.(generic+1), or enterprise.0.specific. */
    static String v2TrapOid(PDUv1 pdu) {
        int generic = pdu.getGenericTrap();
        if (generic >= PDUv1.COLDSTART && generic < PDUv1.ENTERPRISE_SPECIFIC) {
            return SNMP_TRAPS + "." + (generic + 1);
        }
        String enterprise = pdu.getEnterprise() != null ? pdu.getEnterprise().toDottedString() : "";
        return enterprise + ".0." + pdu.getSpecificTrap();
    }

    // --- Workers
    private void workerLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                TrapNotification trap = queue.poll(250, TimeUnit.MILLISECONDS);
                if (trap == null) continue;
                listener.onTrap(trap);
                processed.incrementAndGet();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException ex) {
                log.error("[worker-error] {}", ex.toString(), ex);
            }
        }
    }

    // --- Metrics
    public long getEnqueued(){ return enqueued.get(); }
    public long getDropped(){ return dropped.get(); }
    public long getProcessed(){ return processed.get(); }
}
