/**
 * Default diagnostics backed by SLF4J.
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.core.diagnostic;
