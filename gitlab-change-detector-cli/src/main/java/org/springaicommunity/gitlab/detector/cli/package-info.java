/**
 * Command-line entry point for the GitLab change detector.
 */
@NullMarked
package org.springaicommunity.gitlab.detector.cli;

import org.jspecify.annotations.NullMarked;
