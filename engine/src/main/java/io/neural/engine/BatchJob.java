// file: engine/src/main/java/io/neural/engine/BatchJob.java
package io.neural.engine;

import java.util.Objects;

/**
 * Queued whole-table job. The worker dispatches on the variant.
 */
sealed interface BatchJob permits BatchJob.Dump, BatchJob.Drain {

    long id();

    Requester requester();

    default JobKind kind() {
        return this instanceof Dump ? JobKind.DUMP : JobKind.DRAIN;
    }

    record Dump(long id, Requester requester) implements BatchJob {
        public Dump {
            Objects.requireNonNull(requester, "requester");
        }
    }

    record Drain(long id, Requester requester) implements BatchJob {
        public Drain {
            Objects.requireNonNull(requester, "requester");
        }
    }
}
