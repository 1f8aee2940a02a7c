package com.lucid.mesh.client;

/**
 * A unary method invoked on a blocking stub, e.g. {@code HealthGrpc.HealthBlockingStub::check}.
 *
 * @param <S> stub type
 * @param <Q> request type
 * @param <P> response type
 */
@FunctionalInterface
public interface RpcMethod<S, Q, P> {
    
    P invoke(S stub, Q request);
}
