package ctrlsynth.compile;

import ctrlsynth.ir.Guard;

/** Realized control scope: its logic and the predicate that is true in the cycle the scope completes. */
public record ScopeResult(Guard done, ControlLogicBlock block) {}
