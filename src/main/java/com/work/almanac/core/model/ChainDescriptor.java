package com.work.almanac.core.model;

import java.util.Objects;

import static com.work.almanac.core.support.ValidationUtils.requireValidChainId;
import static com.work.almanac.core.support.ValidationUtils.requireNonNegative;
import static com.work.almanac.core.support.ValidationUtils.requireNonNull;

/**
 * 被索引的链：配置加载后不可变。
 *
 * confirmationDepth 仅在 progressive 链没有外部终局信号时使用。
 */
public final class ChainDescriptor {

    private final String id;
    private final FinalityModel finalityModel;
    private final long confirmationDepth;

    public ChainDescriptor(String id, FinalityModel finalityModel, long confirmationDepth) {
        this.id = requireValidChainId(id);
        this.finalityModel = requireNonNull(finalityModel, "finalityModel");
        this.confirmationDepth = requireNonNegative(confirmationDepth, "confirmationDepth");
    }

    public static ChainDescriptor progressive(String id, long confirmationDepth) {
        return new ChainDescriptor(id, FinalityModel.PROGRESSIVE, confirmationDepth);
    }

    public static ChainDescriptor instant(String id) {
        return new ChainDescriptor(id, FinalityModel.INSTANT, 0);
    }

    public String getId() {
        return id;
    }

    public FinalityModel getFinalityModel() {
        return finalityModel;
    }

    public long getConfirmationDepth() {
        return confirmationDepth;
    }

    public boolean isInstant() {
        return finalityModel == FinalityModel.INSTANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChainDescriptor)) {
            return false;
        }
        ChainDescriptor that = (ChainDescriptor) o;
        return confirmationDepth == that.confirmationDepth
                && id.equals(that.id)
                && finalityModel == that.finalityModel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, finalityModel, confirmationDepth);
    }

    @Override
    public String toString() {
        return "ChainDescriptor{" + id + ", " + finalityModel + ", depth=" + confirmationDepth + "}";
    }
}
