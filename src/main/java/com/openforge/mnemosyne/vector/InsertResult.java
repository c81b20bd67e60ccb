package com.openforge.mnemosyne.vector;

import java.util.List;

public record InsertResult(long insertedCount, List<Object> ids) {}
