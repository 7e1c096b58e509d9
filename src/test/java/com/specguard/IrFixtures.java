package com.specguard;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.specguard.core.ir.AssertClause;
import com.specguard.core.ir.EffectClause;
import com.specguard.core.ir.IntentClause;
import com.specguard.core.ir.IntermediateRepresentation;
import com.specguard.core.ir.Metadata;
import com.specguard.core.ir.Parameter;
import com.specguard.core.ir.SigClause;

/**
 * Small builder for test IRs.
 */
public final class IrFixtures {

    private String intent = "Do something";
    private String name = "fn";
    private final List<Parameter> params = new ArrayList<>();
    private String returns;
    private final List<EffectClause> effects = new ArrayList<>();
    private final List<AssertClause> assertions = new ArrayList<>();

    private IrFixtures() {}

    public static IrFixtures ir() {
        return new IrFixtures();
    }

    public IrFixtures intent(String summary) {
        this.intent = summary;
        return this;
    }

    public IrFixtures named(String functionName) {
        this.name = functionName;
        return this;
    }

    public IrFixtures param(String paramName, String typeHint) {
        params.add(new Parameter(paramName, typeHint));
        return this;
    }

    public IrFixtures returns(String typeHint) {
        this.returns = typeHint;
        return this;
    }

    public IrFixtures effects(String... descriptions) {
        Arrays.stream(descriptions).map(EffectClause::new).forEach(effects::add);
        return this;
    }

    public IrFixtures asserting(String... predicates) {
        Arrays.stream(predicates).map(AssertClause::new).forEach(assertions::add);
        return this;
    }

    public IntermediateRepresentation build() {
        return new IntermediateRepresentation(
                new IntentClause(intent, null),
                new SigClause(name, params, returns),
                effects,
                assertions,
                Metadata.empty()
        );
    }
}
