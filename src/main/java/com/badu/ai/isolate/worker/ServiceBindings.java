package com.badu.ai.isolate.worker;

import com.badu.ai.isolate.InferenceService;
import com.badu.ai.isolate.protocol.Operation;

/**
 * Binds every {@link Operation} of the contract to the corresponding method of an
 * {@link InferenceService}.
 */
public final class ServiceBindings {

    private ServiceBindings() {
    }

    /**
     * Builds the method registry for a service.
     *
     * @param service the real service the worker owns
     * @return registry covering every operation in {@link Operation#values()}
     */
    public static MethodRegistry registryFor(InferenceService service) {
        if (service == null) {
            throw new IllegalArgumentException("Service cannot be null");
        }

        return MethodRegistry.builder()
            .bind(Operation.INIT, service::init)
            .bind(Operation.INIT_RUNTIME, service::initRuntime)
            .bind(Operation.LOAD_EMBEDDING, service::loadEmbedding)
            .bind(Operation.EMBED, service::embed)
            .bind(Operation.SIMILARITY, service::similarity)
            .bindStream(Operation.COMPLETION, service::completion)
            .bindStream(Operation.CHAT, service::chat)
            .bind(Operation.SET_SAMPLER_PARAMS, service::setSamplerParams)
            .bind(Operation.SET_PENALTY_PARAMS, service::setPenaltyParams)
            .bind(Operation.SET_GENERATION_PARAMS, service::setGenerationParams)
            .bind(Operation.GET_GENERATION_STATE, ignored -> service.getGenerationState())
            .bind(Operation.SET_IMAGE, service::setImage)
            .bind(Operation.SET_AUDIO, service::setAudio)
            .bind(Operation.CLEAR_STATE, ignored -> service.clearState())
            .bind(Operation.STOP, ignored -> service.stop())
            .build();
    }
}
