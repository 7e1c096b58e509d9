package com.specguard.core.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * IntermediateRepresentation: structured specification of one intended function.
 *
 * Immutable. Collections are defensively copied and never null; an upstream producer
 * may leave effects or assertions empty, but the validation core always sees lists.
 *
 * INVARIANT: effect order is execution order. The analyzer treats effects as
 * sequential statements.
 */
public class IntermediateRepresentation {

    private final IntentClause intent;
    private final SigClause signature;
    private final List<EffectClause> effects;
    private final List<AssertClause> assertions;
    private final Metadata metadata;

    public IntermediateRepresentation(
            IntentClause intent,
            SigClause signature,
            List<EffectClause> effects,
            List<AssertClause> assertions,
            Metadata metadata
    ) {
        if (intent == null || signature == null) {
            throw new IllegalArgumentException("IR requires both an intent and a signature");
        }
        this.intent     = intent;
        this.signature  = signature;
        this.effects    = effects != null ? List.copyOf(effects) : List.of();
        this.assertions = assertions != null ? List.copyOf(assertions) : List.of();
        this.metadata   = metadata != null ? metadata : Metadata.empty();
    }

    public IntermediateRepresentation(IntentClause intent, SigClause signature, List<EffectClause> effects) {
        this(intent, signature, effects, List.of(), Metadata.empty());
    }

    public IntentClause getIntent()          { return intent; }
    public SigClause getSignature()          { return signature; }
    public List<EffectClause> getEffects()   { return effects; }
    public List<AssertClause> getAssertions() { return assertions; }
    public Metadata getMetadata()            { return metadata; }

    /**
     * Every typed hole in the IR: intent, signature, effects, then assertions.
     */
    public List<TypedHole> typedHoles() {
        List<TypedHole> holes = new ArrayList<>(intent.getHoles());
        holes.addAll(signature.getHoles());
        for (EffectClause effect : effects) {
            holes.addAll(effect.getHoles());
        }
        for (AssertClause assertion : assertions) {
            holes.addAll(assertion.getHoles());
        }
        return holes;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "IR{function=%s, params=%d, effects=%d, assertions=%d}",
                signature.getName(), signature.getParameters().size(),
                effects.size(), assertions.size());
    }
}
