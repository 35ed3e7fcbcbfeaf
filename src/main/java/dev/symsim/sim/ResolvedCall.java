package dev.symsim.sim;

import java.util.Objects;

public sealed interface ResolvedCall permits ResolvedCall.OverrideCall, ResolvedCall.CrucibleCall {
    SimFrame frame();

    record OverrideCall(HostOverride override, SimFrame.OverrideFrame frame) implements ResolvedCall {
        public OverrideCall {
            Objects.requireNonNull(override, "override");
            Objects.requireNonNull(frame, "frame");
        }
    }

    record CrucibleCall(SimFrame.CrucibleFrame frame) implements ResolvedCall {
        public CrucibleCall {
            Objects.requireNonNull(frame, "frame");
        }
    }
}
