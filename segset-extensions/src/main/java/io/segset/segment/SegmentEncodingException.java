/*
 * SegmentEncodingException.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.segset.segment;

import com.google.common.io.BaseEncoding;
import io.segset.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Exception thrown by {@link SegmentCodec} when stored bytes do not describe a valid segment. It keeps
 * a copy of the offending bytes for diagnostics.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class SegmentEncodingException extends SegmentException {
    @Nullable
    private byte[] data;

    public SegmentEncodingException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    /**
     * Set the data array that triggered this exception.
     *
     * @param data raw data that could not be decoded
     * @return this <code>SegmentEncodingException</code>
     */
    @Nonnull
    public SegmentEncodingException setData(@Nonnull byte[] data) {
        this.data = Arrays.copyOf(data, data.length);
        addLogInfo("data", BaseEncoding.base16().encode(data));
        return this;
    }

    /**
     * Return the raw bytes that triggered this exception, or <code>null</code> if none were recorded.
     *
     * @return the data array that triggered the exception
     */
    @Nullable
    public byte[] getData() {
        return (data == null) ? null : Arrays.copyOf(data, data.length);
    }
}
