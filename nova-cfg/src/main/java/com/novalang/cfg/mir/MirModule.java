package com.novalang.cfg.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 模块（编译单元），按名字查找函数的上下文。
 */
public class MirModule {

    private final String name;
    private final List<MirFunction> functions = new ArrayList<>();

    public MirModule(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public List<MirFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public MirFunction createFunction(String functionName, MirType returnType) {
        if (getFunction(functionName) != null) {
            throw new IllegalArgumentException("函数已存在: " + functionName);
        }
        MirFunction fn = new MirFunction(functionName, returnType);
        fn.setModule(this);
        functions.add(fn);
        return fn;
    }

    /** 按名字查找，找不到返回 null */
    public MirFunction getFunction(String functionName) {
        for (MirFunction fn : functions) {
            if (fn.getName().equals(functionName)) return fn;
        }
        return null;
    }

    public boolean removeFunction(MirFunction fn) {
        if (functions.remove(fn)) {
            fn.setModule(null);
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(name).append('\n');
        for (MirFunction fn : functions) {
            sb.append(fn);
        }
        return sb.toString();
    }
}
