package org.lrasolver.solver;

import lombok.Getter;
import org.lrasolver.expressions.formulas.Formula;
import org.lrasolver.simplex.SimplexEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * 作用域栈中的一层：push 之后加入的断言、留给分支搜索的非原子部分，以及 push 时的表格检查点。
 * 基础作用域没有检查点。
 */
@Getter
final class Scope {

    private final List<Formula> assertions = new ArrayList<>();
    private final List<Formula> deferred = new ArrayList<>();
    private final SimplexEngine.Checkpoint checkpoint;

    Scope(SimplexEngine.Checkpoint checkpoint) {
        this.checkpoint = checkpoint;
    }
}
