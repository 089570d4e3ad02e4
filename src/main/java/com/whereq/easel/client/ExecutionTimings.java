package com.whereq.easel.client;

import lombok.Value;

/**
 * Engine-side timing breakdown of one execution, in seconds, never negative
 */
@Value
public class ExecutionTimings {

    double queueSeconds;

    double execSeconds;
}
