/**
Copyright (c) 2012-2014 Microsoft Corporation
   
Module Name:

    UpdrConfig.java

Abstract:

Notes:
    
**/ 

package org.updr;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.updr.enumerations.GeneralizationStrategy;
import org.updr.enumerations.PushFrameZero;
import org.updr.enumerations.TransitionOrder;

/**
 * Settings of an inference run. Instances are immutable; use
 * {@link #builder()} or {@link #fromProperties(Properties)}.
 **/
public final class UpdrConfig
{
    public static final String SEED = "updr.seed";
    public static final String TIMEOUT_MS = "updr.timeout-ms";
    public static final String QUERY_RETRIES = "updr.query.retries";
    public static final String QUERY_BACKOFF = "updr.query.backoff";
    public static final String MEMORY_MAX_MB = "updr.memory-max-mb";
    public static final String MINIMIZE_MODELS = "updr.minimize-models";
    public static final String SIMPLIFY_DIAGRAM = "updr.simplify-diagram";
    public static final String GENERALIZATION = "updr.generalization";
    public static final String SMOKE_TEST = "updr.smoke-test";
    public static final String ASSERT_INDUCTIVE_TRACE = "updr.assert-inductive-trace";
    public static final String BLOCK_MAY_CEXS = "updr.block-may-cexs";
    public static final String PUSH_FRAME_ZERO = "updr.push-frame-zero";
    public static final String TRANSITION_ORDER = "updr.transition-order";
    public static final String MAX_ITERATIONS = "updr.max-iterations";
    public static final String RECHECK_INVARIANT = "updr.recheck-invariant";
    public static final String CONCRETIZE_COUNTEREXAMPLES = "updr.concretize-counterexamples";
    public static final String KEY_PREFIX = "updr.key-prefix";
    public static final String CHECKPOINT_IN = "updr.checkpoint.in";
    public static final String CHECKPOINT_OUT = "updr.checkpoint.out";
    public static final String COUNTEREXAMPLE_JSON = "updr.counterexample.json";
    public static final String Z3_LOG = "updr.z3.log";

    private final int m_seed;
    private final int m_timeoutMs;
    private final int m_queryRetries;
    private final double m_queryBackoff;
    private final int m_memoryMaxMb;
    private final boolean m_minimizeModels;
    private final boolean m_simplifyDiagram;
    private final GeneralizationStrategy m_generalization;
    private final boolean m_smokeTest;
    private final boolean m_assertInductiveTrace;
    private final boolean m_blockMayCexs;
    private final PushFrameZero m_pushFrameZero;
    private final TransitionOrder m_transitionOrder;
    private final int m_maxIterations;
    private final boolean m_recheckInvariant;
    private final boolean m_concretizeCounterexamples;
    private final String m_keyPrefix;
    private final Path m_checkpointIn;
    private final Path m_checkpointOut;
    private final Path m_counterexampleJson;
    private final Path m_z3Log;

    private UpdrConfig(Builder b)
    {
        m_seed = b.m_seed;
        m_timeoutMs = b.m_timeoutMs;
        m_queryRetries = b.m_queryRetries;
        m_queryBackoff = b.m_queryBackoff;
        m_memoryMaxMb = b.m_memoryMaxMb;
        m_minimizeModels = b.m_minimizeModels;
        m_simplifyDiagram = b.m_simplifyDiagram;
        m_generalization = b.m_generalization;
        m_smokeTest = b.m_smokeTest;
        m_assertInductiveTrace = b.m_assertInductiveTrace;
        m_blockMayCexs = b.m_blockMayCexs;
        m_pushFrameZero = b.m_pushFrameZero;
        m_transitionOrder = b.m_transitionOrder;
        m_maxIterations = b.m_maxIterations;
        m_recheckInvariant = b.m_recheckInvariant;
        m_concretizeCounterexamples = b.m_concretizeCounterexamples;
        m_keyPrefix = b.m_keyPrefix;
        m_checkpointIn = b.m_checkpointIn;
        m_checkpointOut = b.m_checkpointOut;
        m_counterexampleJson = b.m_counterexampleJson;
        m_z3Log = b.m_z3Log;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * The default settings.
     **/
    public static UpdrConfig defaults()
    {
        return builder().build();
    }

    /**
     * Reads settings from {@code props}. Absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     **/
    public static UpdrConfig fromProperties(Properties props)
    {
        Builder b = builder();
        String v;
        if ((v = value(props, SEED)) != null)
            b.seed(parseInt(SEED, v));
        if ((v = value(props, TIMEOUT_MS)) != null)
            b.timeoutMs(parseInt(TIMEOUT_MS, v));
        if ((v = value(props, QUERY_RETRIES)) != null)
            b.queryRetries(parseInt(QUERY_RETRIES, v));
        if ((v = value(props, QUERY_BACKOFF)) != null)
            b.queryBackoff(parseDouble(QUERY_BACKOFF, v));
        if ((v = value(props, MEMORY_MAX_MB)) != null)
            b.memoryMaxMb(parseInt(MEMORY_MAX_MB, v));
        if ((v = value(props, MINIMIZE_MODELS)) != null)
            b.minimizeModels(parseBoolean(MINIMIZE_MODELS, v));
        if ((v = value(props, SIMPLIFY_DIAGRAM)) != null)
            b.simplifyDiagram(parseBoolean(SIMPLIFY_DIAGRAM, v));
        if ((v = value(props, GENERALIZATION)) != null)
            b.generalization(parseEnum(GeneralizationStrategy.class, GENERALIZATION, v));
        if ((v = value(props, SMOKE_TEST)) != null)
            b.smokeTest(parseBoolean(SMOKE_TEST, v));
        if ((v = value(props, ASSERT_INDUCTIVE_TRACE)) != null)
            b.assertInductiveTrace(parseBoolean(ASSERT_INDUCTIVE_TRACE, v));
        if ((v = value(props, BLOCK_MAY_CEXS)) != null)
            b.blockMayCexs(parseBoolean(BLOCK_MAY_CEXS, v));
        if ((v = value(props, PUSH_FRAME_ZERO)) != null)
            b.pushFrameZero(parseEnum(PushFrameZero.class, PUSH_FRAME_ZERO, v));
        if ((v = value(props, TRANSITION_ORDER)) != null)
            b.transitionOrder(parseEnum(TransitionOrder.class, TRANSITION_ORDER, v));
        if ((v = value(props, MAX_ITERATIONS)) != null)
            b.maxIterations(parseInt(MAX_ITERATIONS, v));
        if ((v = value(props, RECHECK_INVARIANT)) != null)
            b.recheckInvariant(parseBoolean(RECHECK_INVARIANT, v));
        if ((v = value(props, CONCRETIZE_COUNTEREXAMPLES)) != null)
            b.concretizeCounterexamples(parseBoolean(CONCRETIZE_COUNTEREXAMPLES, v));
        if ((v = props.getProperty(KEY_PREFIX)) != null)
            b.keyPrefix(v.trim());
        if ((v = value(props, CHECKPOINT_IN)) != null)
            b.checkpointIn(Paths.get(v));
        if ((v = value(props, CHECKPOINT_OUT)) != null)
            b.checkpointOut(Paths.get(v));
        if ((v = value(props, COUNTEREXAMPLE_JSON)) != null)
            b.counterexampleJson(Paths.get(v));
        if ((v = value(props, Z3_LOG)) != null)
            b.z3Log(Paths.get(v));
        return b.build();
    }

    private static String value(Properties props, String key)
    {
        String v = props.getProperty(key);
        if (v == null)
            return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static int parseInt(String key, String v)
    {
        try
        {
            return Integer.parseInt(v);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(key + ": not an integer: " + v, e);
        }
    }

    private static double parseDouble(String key, String v)
    {
        try
        {
            return Double.parseDouble(v);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException(key + ": not a number: " + v, e);
        }
    }

    private static boolean parseBoolean(String key, String v)
    {
        if (v.equalsIgnoreCase("true"))
            return true;
        if (v.equalsIgnoreCase("false"))
            return false;
        throw new IllegalArgumentException(key + ": not a boolean: " + v);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String v)
    {
        try
        {
            return Enum.valueOf(type, v.toUpperCase(Locale.ROOT).replace('-', '_'));
        }
        catch (IllegalArgumentException e)
        {
            throw new IllegalArgumentException(key + ": unknown value " + v, e);
        }
    }

    /**
     * The Z3 random seed.
     **/
    public int getSeed()
    {
        return m_seed;
    }

    /**
     * The per-query timeout in milliseconds; 0 for none.
     **/
    public int getTimeoutMs()
    {
        return m_timeoutMs;
    }

    /**
     * How often a query that returned {@code UNKNOWN} is retried. Retries
     * only happen when a timeout is set.
     **/
    public int getQueryRetries()
    {
        return m_queryRetries;
    }

    /**
     * The factor by which the timeout grows with every retry.
     **/
    public double getQueryBackoff()
    {
        return m_queryBackoff;
    }

    /**
     * The Z3 memory ceiling in megabytes; 0 for none.
     **/
    public int getMemoryMaxMb()
    {
        return m_memoryMaxMb;
    }

    public boolean isMinimizeModels()
    {
        return m_minimizeModels;
    }

    public boolean isSimplifyDiagram()
    {
        return m_simplifyDiagram;
    }

    public GeneralizationStrategy getGeneralization()
    {
        return m_generalization;
    }

    public boolean isSmokeTest()
    {
        return m_smokeTest;
    }

    public boolean isAssertInductiveTrace()
    {
        return m_assertInductiveTrace;
    }

    public boolean isBlockMayCexs()
    {
        return m_blockMayCexs;
    }

    public PushFrameZero getPushFrameZero()
    {
        return m_pushFrameZero;
    }

    public TransitionOrder getTransitionOrder()
    {
        return m_transitionOrder;
    }

    /**
     * The number of search iterations after which the search is interrupted;
     * 0 for no limit.
     **/
    public int getMaxIterations()
    {
        return m_maxIterations;
    }

    public boolean isRecheckInvariant()
    {
        return m_recheckInvariant;
    }

    public boolean isConcretizeCounterexamples()
    {
        return m_concretizeCounterexamples;
    }

    /**
     * Prefix of all native symbol names.
     **/
    public String getKeyPrefix()
    {
        return m_keyPrefix;
    }

    public Path getCheckpointIn()
    {
        return m_checkpointIn;
    }

    public Path getCheckpointOut()
    {
        return m_checkpointOut;
    }

    public Path getCounterexampleJson()
    {
        return m_counterexampleJson;
    }

    public Path getZ3Log()
    {
        return m_z3Log;
    }

    /**
     * A builder initialized with these settings.
     **/
    public Builder toBuilder()
    {
        return builder().seed(m_seed).timeoutMs(m_timeoutMs).queryRetries(m_queryRetries)
                .queryBackoff(m_queryBackoff).memoryMaxMb(m_memoryMaxMb).minimizeModels(m_minimizeModels)
                .simplifyDiagram(m_simplifyDiagram).generalization(m_generalization).smokeTest(m_smokeTest)
                .assertInductiveTrace(m_assertInductiveTrace).blockMayCexs(m_blockMayCexs)
                .pushFrameZero(m_pushFrameZero).transitionOrder(m_transitionOrder).maxIterations(m_maxIterations)
                .recheckInvariant(m_recheckInvariant).concretizeCounterexamples(m_concretizeCounterexamples)
                .keyPrefix(m_keyPrefix).checkpointIn(m_checkpointIn).checkpointOut(m_checkpointOut)
                .counterexampleJson(m_counterexampleJson).z3Log(m_z3Log);
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this).add("seed", m_seed).add("timeoutMs", m_timeoutMs)
                .add("queryRetries", m_queryRetries).add("queryBackoff", m_queryBackoff)
                .add("memoryMaxMb", m_memoryMaxMb).add("minimizeModels", m_minimizeModels)
                .add("simplifyDiagram", m_simplifyDiagram).add("generalization", m_generalization)
                .add("smokeTest", m_smokeTest).add("assertInductiveTrace", m_assertInductiveTrace)
                .add("blockMayCexs", m_blockMayCexs).add("pushFrameZero", m_pushFrameZero)
                .add("transitionOrder", m_transitionOrder).add("maxIterations", m_maxIterations)
                .add("recheckInvariant", m_recheckInvariant)
                .add("concretizeCounterexamples", m_concretizeCounterexamples).add("keyPrefix", m_keyPrefix)
                .add("checkpointIn", m_checkpointIn).add("checkpointOut", m_checkpointOut)
                .add("counterexampleJson", m_counterexampleJson).add("z3Log", m_z3Log).toString();
    }

    public static final class Builder
    {
        private int m_seed = 0;
        private int m_timeoutMs = 0;
        private int m_queryRetries = 2;
        private double m_queryBackoff = 2.0;
        private int m_memoryMaxMb = 0;
        private boolean m_minimizeModels = true;
        private boolean m_simplifyDiagram = true;
        private GeneralizationStrategy m_generalization = GeneralizationStrategy.UNSAT_CORE;
        private boolean m_smokeTest = false;
        private boolean m_assertInductiveTrace = false;
        private boolean m_blockMayCexs = false;
        private PushFrameZero m_pushFrameZero = PushFrameZero.ALWAYS;
        private TransitionOrder m_transitionOrder = TransitionOrder.DECLARED;
        private int m_maxIterations = 0;
        private boolean m_recheckInvariant = true;
        private boolean m_concretizeCounterexamples = true;
        private String m_keyPrefix = "";
        private Path m_checkpointIn;
        private Path m_checkpointOut;
        private Path m_counterexampleJson;
        private Path m_z3Log;

        private Builder()
        {
        }

        public Builder seed(int seed)
        {
            m_seed = seed;
            return this;
        }

        public Builder timeoutMs(int timeoutMs)
        {
            Preconditions.checkArgument(timeoutMs >= 0, "%s must not be negative", TIMEOUT_MS);
            m_timeoutMs = timeoutMs;
            return this;
        }

        public Builder queryRetries(int retries)
        {
            Preconditions.checkArgument(retries >= 0, "%s must not be negative", QUERY_RETRIES);
            m_queryRetries = retries;
            return this;
        }

        public Builder queryBackoff(double backoff)
        {
            Preconditions.checkArgument(backoff >= 1.0, "%s must be at least 1", QUERY_BACKOFF);
            m_queryBackoff = backoff;
            return this;
        }

        public Builder memoryMaxMb(int megabytes)
        {
            Preconditions.checkArgument(megabytes >= 0, "%s must not be negative", MEMORY_MAX_MB);
            m_memoryMaxMb = megabytes;
            return this;
        }

        public Builder minimizeModels(boolean minimize)
        {
            m_minimizeModels = minimize;
            return this;
        }

        public Builder simplifyDiagram(boolean simplify)
        {
            m_simplifyDiagram = simplify;
            return this;
        }

        public Builder generalization(GeneralizationStrategy strategy)
        {
            m_generalization = Preconditions.checkNotNull(strategy);
            return this;
        }

        public Builder smokeTest(boolean smokeTest)
        {
            m_smokeTest = smokeTest;
            return this;
        }

        public Builder assertInductiveTrace(boolean check)
        {
            m_assertInductiveTrace = check;
            return this;
        }

        public Builder blockMayCexs(boolean block)
        {
            m_blockMayCexs = block;
            return this;
        }

        public Builder pushFrameZero(PushFrameZero policy)
        {
            m_pushFrameZero = Preconditions.checkNotNull(policy);
            return this;
        }

        public Builder transitionOrder(TransitionOrder order)
        {
            m_transitionOrder = Preconditions.checkNotNull(order);
            return this;
        }

        public Builder maxIterations(int iterations)
        {
            Preconditions.checkArgument(iterations >= 0, "%s must not be negative", MAX_ITERATIONS);
            m_maxIterations = iterations;
            return this;
        }

        public Builder recheckInvariant(boolean recheck)
        {
            m_recheckInvariant = recheck;
            return this;
        }

        public Builder concretizeCounterexamples(boolean concretize)
        {
            m_concretizeCounterexamples = concretize;
            return this;
        }

        public Builder keyPrefix(String prefix)
        {
            m_keyPrefix = Preconditions.checkNotNull(prefix);
            return this;
        }

        public Builder checkpointIn(Path path)
        {
            m_checkpointIn = path;
            return this;
        }

        public Builder checkpointOut(Path path)
        {
            m_checkpointOut = path;
            return this;
        }

        public Builder counterexampleJson(Path path)
        {
            m_counterexampleJson = path;
            return this;
        }

        public Builder z3Log(Path path)
        {
            m_z3Log = path;
            return this;
        }

        public UpdrConfig build()
        {
            return new UpdrConfig(this);
        }
    }
}
