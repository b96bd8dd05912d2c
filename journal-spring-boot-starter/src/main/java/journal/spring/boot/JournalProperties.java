package journal.spring.boot;

import journal.dispatch.DeliveryMode;
import journal.jdbc.TableNames;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the journal router.
 *
 * @see JournalAutoConfiguration
 */
@ConfigurationProperties(prefix = "journal")
public class JournalProperties {

    /**
     * Maximum number of events retained in the router history.
     */
    private int historyCapacity = 1000;

    /**
     * Maximum number of events waiting for dispatch before publishes are dropped.
     */
    private int queueCapacity = 10_000;

    /**
     * How one event is fanned out to its matching listeners.
     */
    private DeliveryMode deliveryMode = DeliveryMode.SEQUENTIAL;

    /**
     * Size of the delivery pool in concurrent mode.
     */
    private int deliveryWorkerCount = 4;

    /**
     * How long close waits for queued events to be delivered.
     */
    private long drainTimeoutMs = 5000;

    /**
     * Database table holding persisted journal outputs.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    /**
     * Whether persisted outputs are registered with the router at startup.
     */
    private boolean restoreOnStartup = true;

    private final Metrics metrics = new Metrics();

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
        this.historyCapacity = historyCapacity;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public DeliveryMode getDeliveryMode() {
        return deliveryMode;
    }

    public void setDeliveryMode(DeliveryMode deliveryMode) {
        this.deliveryMode = deliveryMode;
    }

    public int getDeliveryWorkerCount() {
        return deliveryWorkerCount;
    }

    public void setDeliveryWorkerCount(int deliveryWorkerCount) {
        this.deliveryWorkerCount = deliveryWorkerCount;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public boolean isRestoreOnStartup() {
        return restoreOnStartup;
    }

    public void setRestoreOnStartup(boolean restoreOnStartup) {
        this.restoreOnStartup = restoreOnStartup;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "journal";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
