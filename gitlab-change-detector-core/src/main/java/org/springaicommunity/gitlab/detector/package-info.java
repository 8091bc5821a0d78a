/**
 * GitLab change detector core package.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.gitlab.detector;

import org.jspecify.annotations.NullMarked;
