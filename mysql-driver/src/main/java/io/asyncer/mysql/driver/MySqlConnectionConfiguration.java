/*
 * Copyright 2023 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.driver;

import io.asyncer.mysql.driver.constant.UnreadRowsPolicy;
import io.netty.buffer.ByteBufAllocator;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.driver.internal.util.AssertUtils.require;
import static io.asyncer.mysql.driver.internal.util.AssertUtils.requireNonNull;

/**
 * A configuration of MySQL connection.
 */
public final class MySqlConnectionConfiguration {

    private final Charset clientCharset;

    private final UnreadRowsPolicy unreadRowsPolicy;

    private final ByteBufAllocator allocator;

    private final int readBufferSize;

    private MySqlConnectionConfiguration(Charset clientCharset, UnreadRowsPolicy unreadRowsPolicy,
        ByteBufAllocator allocator, int readBufferSize) {
        this.clientCharset = requireNonNull(clientCharset, "clientCharset must not be null");
        this.unreadRowsPolicy = requireNonNull(unreadRowsPolicy, "unreadRowsPolicy must not be null");
        this.allocator = requireNonNull(allocator, "allocator must not be null");
        this.readBufferSize = readBufferSize;
    }

    /**
     * Creates a builder of the configuration. All options are default.
     *
     * @return the builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    Charset getClientCharset() {
        return clientCharset;
    }

    UnreadRowsPolicy getUnreadRowsPolicy() {
        return unreadRowsPolicy;
    }

    ByteBufAllocator getAllocator() {
        return allocator;
    }

    int getReadBufferSize() {
        return readBufferSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MySqlConnectionConfiguration)) {
            return false;
        }

        MySqlConnectionConfiguration that = (MySqlConnectionConfiguration) o;

        return clientCharset.equals(that.clientCharset) &&
            unreadRowsPolicy == that.unreadRowsPolicy &&
            allocator.equals(that.allocator) &&
            readBufferSize == that.readBufferSize;
    }

    @Override
    public int hashCode() {
        int result = clientCharset.hashCode();
        result = 31 * result + unreadRowsPolicy.hashCode();
        result = 31 * result + allocator.hashCode();
        return 31 * result + readBufferSize;
    }

    @Override
    public String toString() {
        return "MySqlConnectionConfiguration{clientCharset=" + clientCharset +
            ", unreadRowsPolicy=" + unreadRowsPolicy +
            ", allocator=" + allocator.getClass().getSimpleName() +
            ", readBufferSize=" + readBufferSize +
            '}';
    }

    /**
     * A builder for {@link MySqlConnectionConfiguration} creation.
     */
    public static final class Builder {

        private Charset clientCharset = StandardCharsets.UTF_8;

        private UnreadRowsPolicy unreadRowsPolicy = UnreadRowsPolicy.FAIL_FAST;

        private ByteBufAllocator allocator = ByteBufAllocator.DEFAULT;

        private int readBufferSize = 8192;

        /**
         * Builds an immutable {@link MySqlConnectionConfiguration} with current options.
         *
         * @return the {@link MySqlConnectionConfiguration}.
         */
        public MySqlConnectionConfiguration build() {
            return new MySqlConnectionConfiguration(clientCharset, unreadRowsPolicy, allocator, readBufferSize);
        }

        /**
         * Configures the {@link Charset} of the client, it must be the same as the character set of the
         * session, e.g. {@code character_set_results}. Default to {@link StandardCharsets#UTF_8}.
         *
         * @param clientCharset the {@link Charset}.
         * @return {@link Builder this}.
         * @throws IllegalArgumentException if {@code clientCharset} is {@code null}.
         */
        public Builder clientCharset(Charset clientCharset) {
            this.clientCharset = requireNonNull(clientCharset, "clientCharset must not be null");

            return this;
        }

        /**
         * Configures the behavior when a query is issued while the rows of the previous query have not been
         * fully read. Default to {@link UnreadRowsPolicy#FAIL_FAST}.
         *
         * @param unreadRowsPolicy the policy.
         * @return {@link Builder this}.
         * @throws IllegalArgumentException if {@code unreadRowsPolicy} is {@code null}.
         */
        public Builder unreadRowsPolicy(UnreadRowsPolicy unreadRowsPolicy) {
            this.unreadRowsPolicy = requireNonNull(unreadRowsPolicy, "unreadRowsPolicy must not be null");

            return this;
        }

        /**
         * Configures the {@link ByteBufAllocator} of packets. Default to {@link ByteBufAllocator#DEFAULT}.
         *
         * @param allocator the {@link ByteBufAllocator}.
         * @return {@link Builder this}.
         * @throws IllegalArgumentException if {@code allocator} is {@code null}.
         */
        public Builder allocator(ByteBufAllocator allocator) {
            this.allocator = requireNonNull(allocator, "allocator must not be null");

            return this;
        }

        /**
         * Configures the buffer size of the connection streams. Default to {@code 8192}.
         *
         * @param readBufferSize the buffer size.
         * @return {@link Builder this}.
         * @throws IllegalArgumentException if {@code readBufferSize} is not positive.
         */
        public Builder readBufferSize(int readBufferSize) {
            require(readBufferSize > 0, "readBufferSize must be positive");

            this.readBufferSize = readBufferSize;
            return this;
        }

        private Builder() { }
    }
}
