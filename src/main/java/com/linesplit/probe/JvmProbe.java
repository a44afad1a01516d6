package com.linesplit.probe;

import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link Probe} backed by {@link System#nanoTime()} and the JVM's management beans.
 * <p>
 * Collections are counted on the young-generation collectors, the JVM's closest analogue of a
 * generation-0 collection. When no known young collector is present every collector is counted,
 * and when the JVM exposes no collector at all (Epsilon) the count stays at 0. Allocated bytes come
 * from {@link com.sun.management.ThreadMXBean#getCurrentThreadAllocatedBytes()} and stay at 0 on
 * JVMs that do not support per-thread allocation accounting. Both fallbacks are logged once.
 */
public final class JvmProbe implements Probe {
    private static final Logger log = LoggerFactory.getLogger(JvmProbe.class);

    private static final Set<String> YOUNG_COLLECTORS = Set.of(
            "G1 Young Generation",
            "PS Scavenge",
            "Copy",
            "ParNew",
            "ZGC Minor Cycles",
            "ZGC Minor Pauses",
            "Shenandoah Cycles");

    private final GarbageCollectorMXBean[] collectors;
    private final com.sun.management.ThreadMXBean allocationBean;

    JvmProbe(List<GarbageCollectorMXBean> collectors, com.sun.management.ThreadMXBean allocationBean) {
        this.collectors = collectors.toArray(new GarbageCollectorMXBean[0]);
        this.allocationBean = allocationBean;
    }

    /**
     * Create a probe over the running JVM.
     *
     * @throws BenchException if the management platform cannot be reached
     */
    public static JvmProbe create() throws BenchException {
        return create(ManagementFactory::getGarbageCollectorMXBeans, ManagementFactory::getThreadMXBean);
    }

    static JvmProbe create(Supplier<List<GarbageCollectorMXBean>> collectorLookup,
                           Supplier<ThreadMXBean> threadBeanLookup) throws BenchException {
        List<GarbageCollectorMXBean> allCollectors;
        ThreadMXBean threadBean;
        try {
            allCollectors = collectorLookup.get();
            threadBean = threadBeanLookup.get();
        } catch (RuntimeException e) {
            throw new BenchException(ErrorType.PROBE_UNAVAILABLE,
                    "JVM management beans are unavailable: " + e.getMessage(), e);
        }

        var collectors = selectYoungCollectors(allCollectors);
        if (collectors.isEmpty()) {
            log.warn("No garbage collector beans exposed by this JVM, collection counts will read 0");
        } else {
            log.debug("Counting collections of {}", collectors.stream().map(GarbageCollectorMXBean::getName).toList());
        }

        return new JvmProbe(collectors, allocationBeanOf(threadBean));
    }

    static List<GarbageCollectorMXBean> selectYoungCollectors(List<GarbageCollectorMXBean> allCollectors) {
        var young = new ArrayList<GarbageCollectorMXBean>();
        for (var collector : allCollectors) {
            if (YOUNG_COLLECTORS.contains(collector.getName())) {
                young.add(collector);
            }
        }
        return young.isEmpty() ? List.copyOf(allCollectors) : young;
    }

    private static com.sun.management.ThreadMXBean allocationBeanOf(ThreadMXBean threadBean) {
        if (!(threadBean instanceof com.sun.management.ThreadMXBean)) {
            log.warn("Thread allocation accounting is not available, allocated bytes will read 0");
            return null;
        }
        var bean = (com.sun.management.ThreadMXBean) threadBean;
        if (!bean.isThreadAllocatedMemorySupported()) {
            log.warn("Thread allocation accounting is not supported, allocated bytes will read 0");
            return null;
        }
        if (!bean.isThreadAllocatedMemoryEnabled()) {
            bean.setThreadAllocatedMemoryEnabled(true);
        }
        return bean;
    }

    @Override
    public long now() {
        return System.nanoTime();
    }

    @Override
    public long collectionCount() {
        long total = 0;
        for (var collector : collectors) {
            long count = collector.getCollectionCount();
            // -1 means the collector does not report a count
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    @Override
    public long allocatedBytes() {
        if (allocationBean == null) {
            return 0;
        }
        long bytes = allocationBean.getCurrentThreadAllocatedBytes();
        return Math.max(bytes, 0);
    }

    public boolean tracksAllocations() {
        return allocationBean != null;
    }

    public int collectorCount() {
        return collectors.length;
    }
}
