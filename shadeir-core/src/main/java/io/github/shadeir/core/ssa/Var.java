package io.github.shadeir.core.ssa;

import io.github.shadeir.core.ext.CommonExts;
import io.github.shadeir.core.ext.Ext;
import io.github.shadeir.core.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

/**
 * An SSA value.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable, for display.
     */
    public final String name;
    /**
     * Distinguishes variables of the same name, if {@link Function#UNIQUE_VAR_NAMES} is set.
     */
    public final int index;
    /**
     * The width of the value in bits. Booleans are 1 bit wide.
     */
    public final int bitSize;

    Var(String name, int index, int bitSize) {
        this.name = name;
        this.index = index;
        this.bitSize = bitSize;
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    // exts
    private Effect assignedAt = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        super.removeExt(ext);
    }
}
