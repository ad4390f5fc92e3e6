package com.legal.reasoner;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.legal.reasoner.api.FactKey;
import com.legal.reasoner.api.Interval;
import com.legal.reasoner.api.ReasoningListener;
import com.legal.reasoner.authority.AuthorityMultiplierCalculator;
import com.legal.reasoner.authority.CitationSignals;
import com.legal.reasoner.engine.FixedPointEngine;
import com.legal.reasoner.engine.Interpretation;
import com.legal.reasoner.export.InterpretationExporter;
import com.legal.reasoner.graph.Graph;
import com.legal.reasoner.io.ConfigLoader;
import com.legal.reasoner.io.GraphLoader;
import com.legal.reasoner.io.LoadedGraph;
import com.legal.reasoner.io.ReasonerConfig;
import com.legal.reasoner.io.RuleCompiler;
import com.legal.reasoner.rule.Rule;
import com.legal.reasoner.util.CompositeReasoningListener;
import com.legal.reasoner.util.DerivationExplain;
import com.legal.reasoner.util.RunStatsListener;

/**
 * A high-level wrapper that wires configuration, loaders, the authority
 * calculator, the engine and the exporter together.
 * <p>
 * This class handles:
 * <ul>
 * <li>Loading and validating configuration (classpath defaults or a file)</li>
 * <li>Reading graphs and rule sets from JSON</li>
 * <li>Scaling rule weights by citation authority</li>
 * <li>Running the {@link FixedPointEngine} with registered listeners</li>
 * <li>Exporting results under a redaction profile</li>
 * </ul>
 * Every collaborator receives its configuration through its constructor; the
 * facade holds no per-run state, so runs are independent of each other.
 * Registered listeners are the exception: they are shared by every run and
 * see the callbacks of concurrent runs interleaved. {@link RunStatsListener}
 * is safe for that; a custom listener used from several threads must
 * synchronize itself.
 */
public class LegalReasoner {
    private static final Logger log = LogManager.getLogger(LegalReasoner.class);

    private final ReasonerConfig config;
    private final FixedPointEngine engine;
    private final AuthorityMultiplierCalculator authority;
    private final InterpretationExporter exporter;
    private final GraphLoader graphLoader;
    private final RuleCompiler ruleCompiler = new RuleCompiler();
    private final CompositeReasoningListener compositeListener = new CompositeReasoningListener();

    /** Uses the configuration shipped on the classpath. */
    public LegalReasoner() {
        this(new ConfigLoader().loadDefaults());
    }

    public LegalReasoner(ReasonerConfig config) {
        this.config = config;
        this.engine = new FixedPointEngine(config.engine());
        this.engine.setListener(compositeListener);
        this.authority = new AuthorityMultiplierCalculator(config.authority(), config.hierarchy());
        this.exporter = new InterpretationExporter(config.profiles());
        this.graphLoader = new GraphLoader(config.metadataKeys());
        log.info("LegalReasoner ready: profiles={}, parallelism={}", exporter.profileNames(),
                config.engine().parallelism());
    }

    /**
     * Registers a listener for every subsequent run. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(ReasoningListener listener) {
        compositeListener.add(listener);
    }

    /**
     * Enables run statistics. Use the returned listener to dump them.
     */
    public RunStatsListener enableRunStats() {
        RunStatsListener stats = new RunStatsListener();
        compositeListener.add(stats);
        return stats;
    }

    public LoadedGraph loadGraph(Path path) {
        try {
            return graphLoader.load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph from " + path, e);
        }
    }

    public LoadedGraph parseGraph(String json) {
        return graphLoader.parse(json);
    }

    public List<Rule> loadRules(Path path) {
        try {
            return ruleCompiler.load(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule set from " + path, e);
        }
    }

    public List<Rule> parseRules(String json) {
        return ruleCompiler.parse(json);
    }

    /** Scales a rule's weight by the authority of the citation behind it. */
    public Rule applyAuthority(Rule rule, CitationSignals signals) {
        Rule scaled = authority.scale(rule, signals);
        log.debug("Rule {} weight {} -> {} ({})", rule.id(), rule.weight(), scaled.weight(), signals);
        return scaled;
    }

    public Interpretation run(Graph graph, Map<FactKey, Interval> initialFacts, List<Rule> rules, int tmax) {
        return engine.run(graph, initialFacts, rules, tmax);
    }

    public Interpretation run(LoadedGraph loaded, List<Rule> rules, int tmax) {
        return engine.run(loaded.graph(), loaded.initialFacts(), rules, tmax);
    }

    public String export(Interpretation interpretation, String profile) {
        return exporter.export(interpretation, profile);
    }

    public DerivationExplain explain(Interpretation interpretation) {
        return new DerivationExplain(interpretation);
    }

    public ReasonerConfig config() {
        return config;
    }

    public AuthorityMultiplierCalculator authority() {
        return authority;
    }

    public InterpretationExporter exporter() {
        return exporter;
    }
}
