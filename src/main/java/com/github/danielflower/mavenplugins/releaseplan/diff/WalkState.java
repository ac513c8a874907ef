package com.github.danielflower.mavenplugins.releaseplan.diff;

/**
 * Where the working copy is while a diff is being calculated.
 */
enum WalkState {
    AT_HEAD,
    WALKING,
    RESTORING
}
