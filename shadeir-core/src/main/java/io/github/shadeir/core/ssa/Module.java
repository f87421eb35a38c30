package io.github.shadeir.core.ssa;

import java.util.ArrayList;
import java.util.List;

/**
 * A shader: a named collection of {@link Function}s.
 */
public final class Module {
    /**
     * The name of the shader.
     */
    public final String name;
    /**
     * The functions of the shader.
     */
    public final List<Function> functions = new ArrayList<>();

    public Module(String name) {
        this.name = name;
    }

    /**
     * Create a function and add it to this module.
     *
     * @param name The name of the function.
     * @return The function.
     */
    public Function newFunction(String name) {
        Function func = new Function(name);
        functions.add(func);
        return func;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("shader ").append(name).append('\n');
        for (Function func : functions) {
            sb.append(func).append('\n');
        }
        return sb.toString();
    }
}
