/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.dataprep.container.obj;

import org.apache.commons.lang3.StringUtils;

/**
 * How missing values are handled: {@link Kind#MEAN}, {@link Kind#MEDIAN}, {@link Kind#DROP}, or
 * {@link Kind#UNKNOWN} for any other name.
 *
 * <p>
 * An unknown strategy is accepted when the config is built; it keeps its raw name so the warning emitted when it
 * falls back to mean can tell which value was configured.
 */
public final class MissingValueStrategy {

    public static enum Kind {
        MEAN, MEDIAN, DROP, UNKNOWN
    }

    public static final MissingValueStrategy MEAN = new MissingValueStrategy(Kind.MEAN, "mean");
    public static final MissingValueStrategy MEDIAN = new MissingValueStrategy(Kind.MEDIAN, "median");
    public static final MissingValueStrategy DROP = new MissingValueStrategy(Kind.DROP, "drop");

    private final Kind kind;

    private final String name;

    private MissingValueStrategy(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * Parse strategy by name, case insensitive. Never fails: unrecognized names give an {@link Kind#UNKNOWN}
     * strategy.
     */
    public static MissingValueStrategy of(String name) {
        String trimmed = StringUtils.trimToEmpty(name);
        for(MissingValueStrategy known: new MissingValueStrategy[] { MEAN, MEDIAN, DROP }) {
            if(known.name.equalsIgnoreCase(trimmed)) {
                return known;
            }
        }
        return new MissingValueStrategy(Kind.UNKNOWN, name);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + (name == null ? 0 : name.hashCode());
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof MissingValueStrategy)) {
            return false;
        }
        MissingValueStrategy other = (MissingValueStrategy) obj;
        return kind == other.kind && StringUtils.equals(name, other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
