/*
 * Copyright 2025 Netflix, Inc.
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


package com.netflix.spiffe.enable.webhook.admission;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@link AdmissionReview} requests to pod mutations, and mutation results back to admission responses.
 */
@Singleton
public class AdmissionReviewHandler {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionReviewHandler.class);

    static final String REASON_FORBIDDEN = "Forbidden";
    static final String REASON_BAD_REQUEST = "BadRequest";
    static final String REASON_INTERNAL_ERROR = "InternalError";

    private final PodMutator podMutator;
    private final AdmissionReviewCodec codec;

    @Inject
    public AdmissionReviewHandler(PodMutator podMutator, AdmissionReviewCodec codec) {
        this.podMutator = podMutator;
        this.codec = codec;
    }

    /**
     * Handles a serialized admission review, as received by the webhook endpoint. Malformed reviews are answered
     * with a rejection instead of an exception.
     */
    public String handle(String body) {
        AdmissionReview review;
        try {
            review = codec.decode(body);
        } catch (SpiffeEnableException e) {
            logger.warn("Received malformed admission review: {}", e.getMessage());
            return codec.encode(AdmissionReview.ofResponse(null, rejected(null, e)));
        }
        return codec.encode(handle(review));
    }

    public AdmissionReview handle(AdmissionReview review) {
        AdmissionRequest request = review.getRequest();
        if (request == null) {
            SpiffeEnableException error = SpiffeEnableException.malformedRequest("admission review has no request");
            logger.warn("Received malformed admission review: {}", error.getMessage());
            return AdmissionReview.ofResponse(review.getApiVersion(), rejected(null, error));
        }
        return AdmissionReview.ofResponse(review.getApiVersion(), toResponse(request.getUid(), podMutator.mutate(request)));
    }

    private AdmissionResponse toResponse(String uid, MutationResult result) {
        switch (result.getOutcome()) {
            case Allowed:
                return AdmissionResponse.allowed(uid, result.getMessage());
            case Patched:
                return AdmissionResponse.patched(uid, codec.encodePatch(result.getPatch().get()));
            case Denied:
                return AdmissionResponse.rejected(uid, 403, result.getMessage(), REASON_FORBIDDEN);
            case Errored:
            default:
                return rejected(uid, result.getError().orElseGet(() -> SpiffeEnableException.internal(new IllegalStateException(result.getMessage()))));
        }
    }

    private static AdmissionResponse rejected(String uid, SpiffeEnableException error) {
        int code = error.getErrorCode().getHttpStatus();
        return AdmissionResponse.rejected(uid, code, error.getMessage(), code < 500 ? REASON_BAD_REQUEST : REASON_INTERNAL_ERROR);
    }
}
