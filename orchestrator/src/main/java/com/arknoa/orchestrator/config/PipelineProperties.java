package com.arknoa.orchestrator.config;

import com.arknoa.orchestrator.stage.BackoffPolicy;
import com.arknoa.orchestrator.stage.ConfigurationException;
import com.arknoa.orchestrator.stage.StageDescriptor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under the {@code pipeline.*} prefix in application.yml.
 *
 * <pre>
 * pipeline:
 *   order: [intake, classifier, ...]
 *   stages:
 *     classifier:
 *       endpoint: http://classifier:8000
 *       timeout: 60s
 *       max-retries: 2
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Stage names in execution order. */
    private List<String> order = new ArrayList<>();

    private Map<String, Stage> stages = new LinkedHashMap<>();

    /** Identifies this orchestrator instance as a lease holder; random when blank. */
    private String instanceId;

    /** Added on top of the stage timeout when sizing a lease. */
    private Duration leaseGrace = Duration.ofSeconds(30);

    /** Ready requests examined per dispatch tick. */
    private int dispatchBatch = 50;

    /** Events handled per partition per poll. */
    private int consumeBatch = 100;

    /** Partitions per topic; events are partitioned by request id. */
    private int partitions = 8;

    private int invokerThreads = 8;

    /** Queued invocations allowed beyond the busy threads before polling stops. */
    private int invokerQueue = 32;

    /** Re-read attempts after a stale conditional write. */
    private int maxCasRetries = 3;

    /** Expired leases examined per sweep. */
    private int sweepBatch = 100;

    public static class Stage {
        private String   endpoint;
        private Integer  position;
        private Duration timeout     = Duration.ofSeconds(60);
        private int      maxRetries  = 2;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration backoffCap  = Duration.ofSeconds(30);
        private double   jitter      = 0.5;
        private boolean  idempotent  = true;

        public String   getEndpoint()    { return endpoint; }
        public Integer  getPosition()    { return position; }
        public Duration getTimeout()     { return timeout; }
        public int      getMaxRetries()  { return maxRetries; }
        public Duration getBackoffBase() { return backoffBase; }
        public Duration getBackoffCap()  { return backoffCap; }
        public double   getJitter()      { return jitter; }
        public boolean  isIdempotent()   { return idempotent; }

        public void setEndpoint(String v)      { this.endpoint = v; }
        public void setPosition(Integer v)     { this.position = v; }
        public void setTimeout(Duration v)     { this.timeout = v; }
        public void setMaxRetries(int v)       { this.maxRetries = v; }
        public void setBackoffBase(Duration v) { this.backoffBase = v; }
        public void setBackoffCap(Duration v)  { this.backoffCap = v; }
        public void setJitter(double v)        { this.jitter = v; }
        public void setIdempotent(boolean v)   { this.idempotent = v; }
    }

    /**
     * Build descriptors in declared order. A stage without an explicit
     * position gets 10 × (index + 1), leaving room to slot new stages in later.
     *
     * @throws ConfigurationException if the order names a stage with no settings
     */
    public List<StageDescriptor> toDescriptors() {
        List<StageDescriptor> result = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            String name = order.get(i);
            Stage s = stages.get(name);
            if (s == null) {
                throw new ConfigurationException(
                        "pipeline.order references unregistered stage '" + name + "'");
            }
            int position = s.getPosition() != null ? s.getPosition() : 10 * (i + 1);
            result.add(new StageDescriptor(name, position, s.getEndpoint(), s.getTimeout(),
                    s.getMaxRetries(),
                    new BackoffPolicy(s.getBackoffBase(), s.getBackoffCap(), s.getJitter()),
                    s.isIdempotent()));
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public List<String>       getOrder()          { return order; }
    public Map<String, Stage> getStages()         { return stages; }
    public String             getInstanceId()     { return instanceId; }
    public Duration           getLeaseGrace()     { return leaseGrace; }
    public int                getDispatchBatch()  { return dispatchBatch; }
    public int                getConsumeBatch()   { return consumeBatch; }
    public int                getPartitions()     { return partitions; }
    public int                getInvokerThreads() { return invokerThreads; }
    public int                getInvokerQueue()   { return invokerQueue; }
    public int                getMaxCasRetries()  { return maxCasRetries; }
    public int                getSweepBatch()     { return sweepBatch; }

    public void setOrder(List<String> v)          { this.order = v; }
    public void setStages(Map<String, Stage> v)   { this.stages = v; }
    public void setInstanceId(String v)           { this.instanceId = v; }
    public void setLeaseGrace(Duration v)         { this.leaseGrace = v; }
    public void setDispatchBatch(int v)           { this.dispatchBatch = v; }
    public void setConsumeBatch(int v)            { this.consumeBatch = v; }
    public void setPartitions(int v)              { this.partitions = v; }
    public void setInvokerThreads(int v)          { this.invokerThreads = v; }
    public void setInvokerQueue(int v)            { this.invokerQueue = v; }
    public void setMaxCasRetries(int v)           { this.maxCasRetries = v; }
    public void setSweepBatch(int v)              { this.sweepBatch = v; }
}
