/**
 * HTTP boundary: REST controllers over the sermon flow orchestrator and the sermon repository, plus the
 * global exception handler.
 *
 * <p>Controllers are thin adapters; phase rules and error capture live in
 * {@link com.phillippitts.sermonflow.service.orchestration.SermonFlowOrchestrator}.
 */
package com.phillippitts.sermonflow.presentation;
