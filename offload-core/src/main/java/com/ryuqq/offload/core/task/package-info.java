/**
 * Units of work and their pairing with results.
 *
 * @since 1.0.0
 */
package com.ryuqq.offload.core.task;
