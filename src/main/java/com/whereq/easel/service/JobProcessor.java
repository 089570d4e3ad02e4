package com.whereq.easel.service;

import com.whereq.easel.model.GenerationJob;
import reactor.core.publisher.Mono;

/**
 * Runs one admitted job end to end.
 *
 * The processor owns failure reporting for the job. An error it signals is logged by the
 * admission controller and otherwise ignored.
 */
@FunctionalInterface
public interface JobProcessor {

    Mono<Void> process(GenerationJob job);
}
