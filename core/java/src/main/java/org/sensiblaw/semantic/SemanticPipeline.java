package org.sensiblaw.semantic;

import org.sensiblaw.semantic.lexicon.LegalLexicon;
import org.sensiblaw.semantic.logic.LogicTree;
import org.sensiblaw.semantic.logic.LogicTreeBuilder;
import org.sensiblaw.semantic.model.TokenStream;
import org.sensiblaw.semantic.obligation.ExtractionConfig;
import org.sensiblaw.semantic.obligation.ObligationAtom;
import org.sensiblaw.semantic.obligation.ObligationExtractor;
import org.sensiblaw.semantic.obligation.ObligationIdentity;
import org.sensiblaw.semantic.obligation.ObligationIdentityScheme;
import org.sensiblaw.semantic.obligation.ObligationRefiner;
import org.sensiblaw.semantic.obligation.OblIdV1;
import org.sensiblaw.semantic.reference.CrIdV1;
import org.sensiblaw.semantic.reference.Reference;
import org.sensiblaw.semantic.reference.ReferenceExtractor;
import org.sensiblaw.semantic.reference.ReferenceIdentities;
import org.sensiblaw.semantic.reference.ReferenceIdentity;
import org.sensiblaw.semantic.reference.ReferenceIdentityScheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs the per-document stages in order: tokens, tree, references, reference identities,
 * obligations, refinement, obligation identities.
 *
 * <p>Instances hold only the immutable lexicon and identity schemes and may be shared
 * between threads. Documents never see each other's state.
 */
public class SemanticPipeline {

    private static final Logger log = LoggerFactory.getLogger(SemanticPipeline.class);

    private final LogicTreeBuilder treeBuilder;
    private final ReferenceExtractor referenceExtractor;
    private final ReferenceIdentityScheme referenceScheme;
    private final ObligationExtractor obligationExtractor;
    private final ObligationIdentityScheme obligationScheme;
    private final ExtractionConfig config;

    public SemanticPipeline() {
        this(LegalLexicon.defaults(), ExtractionConfig.defaults());
    }

    public SemanticPipeline(LegalLexicon lexicon, ExtractionConfig config) {
        this(lexicon, config, new CrIdV1(), new OblIdV1());
    }

    public SemanticPipeline(LegalLexicon lexicon, ExtractionConfig config,
                            ReferenceIdentityScheme referenceScheme, ObligationIdentityScheme obligationScheme) {
        this.treeBuilder = new LogicTreeBuilder(lexicon);
        this.referenceExtractor = new ReferenceExtractor(lexicon);
        this.referenceScheme = referenceScheme;
        this.obligationExtractor = new ObligationExtractor(lexicon, referenceScheme);
        this.obligationScheme = obligationScheme;
        this.config = config;
    }

    public DocumentAnalysis analyze(TokenStream stream) {
        LogicTree tree = treeBuilder.build(stream);
        List<Reference> references = referenceExtractor.extract(tree);
        List<ReferenceIdentity> identities = ReferenceIdentities.identify(references, referenceScheme);
        List<ObligationAtom> raw = obligationExtractor.extract(tree, identities, config);
        ObligationRefiner.Refinement refinement = ObligationRefiner.refine(raw);
        List<ObligationIdentity> obligations = obligationScheme.identify(refinement.atoms());
        log.info("Analyzed {}@{}: {} clauses, {} references, {} obligations ({} raw)",
                stream.docId(), stream.revId(), tree.clauses().size(), references.size(),
                obligations.size(), raw.size());
        return new DocumentAnalysis(tree, references, identities, refinement, obligations);
    }

    /**
     * Analyzes independent documents on the given executor. Results keep the input order.
     * The executor is not shut down.
     */
    public List<DocumentAnalysis> analyzeAll(List<TokenStream> streams, ExecutorService executor) {
        List<Future<DocumentAnalysis>> futures = new ArrayList<>(streams.size());
        for (TokenStream stream : streams) {
            futures.add(executor.submit(() -> analyze(stream)));
        }
        List<DocumentAnalysis> results = new ArrayList<>(streams.size());
        for (Future<DocumentAnalysis> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new CompletionException("Interrupted while analyzing documents", e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) throw re;
                throw new CompletionException(cause);
            }
        }
        return results;
    }
}
