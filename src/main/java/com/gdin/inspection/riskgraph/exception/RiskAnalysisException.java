package com.gdin.inspection.riskgraph.exception;

/**
 * 风险分析引擎的异常基类。
 */
public class RiskAnalysisException extends RuntimeException {

    public RiskAnalysisException(String message) {
        super(message);
    }

    public RiskAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
