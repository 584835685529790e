package com.gdin.inspection.riskgraph.exception;

import com.gdin.inspection.riskgraph.models.Fact;
import lombok.Getter;

/**
 * 结构非法的事实（主体 / 客体 / 谓词缺失），会破坏建图，直接抛给调用方。
 */
@Getter
public class MalformedFactException extends RiskAnalysisException {

    private final transient Fact fact;

    public MalformedFactException(String message, Fact fact) {
        super(message + ": " + fact);
        this.fact = fact;
    }
}
