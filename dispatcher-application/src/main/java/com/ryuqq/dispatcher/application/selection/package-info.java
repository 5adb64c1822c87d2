/**
 * Elimination Pipeline and Selector.
 *
 * <p>Narrows the configured services to a single best match through four ordered stages
 * (collection, variable subsetting, output format, spatial subsetting). Stages report an empty
 * result as {@link com.ryuqq.dispatcher.application.selection.StageResult.Unsupported}; the
 * {@link com.ryuqq.dispatcher.application.selection.ServiceSelector} turns that into the no-match
 * descriptor rather than an error.</p>
 *
 * <h2>Tie-break</h2>
 * <p>The first surviving candidate in configuration order wins. Wildcard media types resolve to
 * the first declared format of the first candidate that accepts them.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
package com.ryuqq.dispatcher.application.selection;
