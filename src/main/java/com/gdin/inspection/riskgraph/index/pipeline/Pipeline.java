package com.gdin.inspection.riskgraph.index.pipeline;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public class Pipeline<C> implements Iterable<Pipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        WorkflowFunction<C> fn;
    }

    private final String name;
    private final List<Step<C>> steps = new ArrayList<>();

    public Pipeline(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Pipeline<C> add(String stepName, WorkflowFunction<C> fn) {
        steps.add(new Step<>(stepName, fn));
        return this;
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>(steps.size());
        for (Step<C> s : steps) names.add(s.getName());
        return Collections.unmodifiableList(names);
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return Collections.unmodifiableList(steps).iterator();
    }
}
