package com.openforge.mnemosyne.vector;

/** {@code deleteCount} may be approximate on backends that delete lazily. */
public record DeleteResult(long deleteCount) {}
