package com.intteq.broker.rpc.ledger;

import com.intteq.broker.rpc.envelope.EnvelopeCodec;
import com.intteq.broker.rpc.envelope.RpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link IdempotencyLedger} backed by the {@code processed_requests} table.
 *
 * <p>Each record is inserted in its own transaction (the template is expected to use
 * {@code PROPAGATION_REQUIRES_NEW}) so a lost race only rolls back the ledger insert.
 * The response is stored exactly as it is published, so replays are byte-identical.
 */
@Slf4j
public class JpaIdempotencyLedger implements IdempotencyLedger {

    private final ProcessedRequestRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final EnvelopeCodec codec;
    private final Clock clock;

    public JpaIdempotencyLedger(ProcessedRequestRepository repository,
                                TransactionTemplate transactionTemplate,
                                EnvelopeCodec codec,
                                Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<RpcResponse> lookup(String id) {
        return repository.findById(id)
                .map(row -> codec.decodeResponse(row.getResponseJson()));
    }

    @Override
    public boolean record(String id, RpcResponse response) {
        String json = codec.encodeResponseAsString(response);
        try {
            transactionTemplate.executeWithoutResult(status ->
                    repository.saveAndFlush(new ProcessedRequest(id, json, Instant.now(clock))));
            return true;
        } catch (DataIntegrityViolationException e) {
            if (repository.existsById(id)) {
                log.info("Ledger already holds a response for {}; keeping the first one", id);
                return false;
            }
            throw e;
        }
    }
}
