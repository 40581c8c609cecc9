package com.iimsoft.planner.solver;

/**
 * 无环图上松弛轮数超过上限。正常输入不会出现，出现即说明求解逻辑有问题。
 */
public class RelaxationLimitExceededException extends IllegalStateException {

    private final int passes;

    public RelaxationLimitExceededException(String phase, int passes, int nodeCount) {
        super(phase + " relaxation did not converge after " + passes + " passes over " + nodeCount + " nodes");
        this.passes = passes;
    }

    public int getPasses() {
        return passes;
    }
}
