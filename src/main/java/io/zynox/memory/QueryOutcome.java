package io.zynox.memory;

import java.util.List;

/**
 * Result of a query scan.
 *
 * @param matches   matching records in storage order
 * @param undecryptable number of rows dropped because their ciphertext could not be decrypted
 */
public record QueryOutcome(List<QueryMatch> matches, int undecryptable) {

    public QueryOutcome {
        matches = List.copyOf(matches);
    }
}
