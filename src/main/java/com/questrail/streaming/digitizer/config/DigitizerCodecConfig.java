package com.questrail.streaming.digitizer.config;

import com.questrail.streaming.digitizer.codec.Ownership;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.UnpooledByteBufAllocator;

import java.util.Objects;

/**
 * Configuration shared by the digitizer message codecs.
 *
 * @param strictChannels   reject duplicate analog channel numbers instead of warning
 * @param defaultOwnership ownership used by {@code decode(ByteBuf)} when none is given
 * @param allocator        allocator for encoded output buffers
 */
public record DigitizerCodecConfig(
    boolean strictChannels,
    Ownership defaultOwnership,
    ByteBufAllocator allocator
) {
    private static final DigitizerCodecConfig DEFAULTS = builder().build();

    public DigitizerCodecConfig {
        Objects.requireNonNull(defaultOwnership, "defaultOwnership");
        Objects.requireNonNull(allocator, "allocator");
    }

    public static DigitizerCodecConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean strictChannels = false;
        private Ownership defaultOwnership = Ownership.BORROWED;
        private ByteBufAllocator allocator = UnpooledByteBufAllocator.DEFAULT;

        public Builder withStrictChannels(boolean strictChannels) {
            this.strictChannels = strictChannels;
            return this;
        }

        public Builder withDefaultOwnership(Ownership defaultOwnership) {
            this.defaultOwnership = defaultOwnership;
            return this;
        }

        public Builder withAllocator(ByteBufAllocator allocator) {
            this.allocator = allocator;
            return this;
        }

        public DigitizerCodecConfig build() {
            return new DigitizerCodecConfig(strictChannels, defaultOwnership, allocator);
        }
    }
}
