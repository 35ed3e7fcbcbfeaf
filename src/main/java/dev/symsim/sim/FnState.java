package dev.symsim.sim;

import dev.symsim.cfg.Cfg;
import dev.symsim.cfg.Postdominators;
import java.util.Objects;

public sealed interface FnState permits FnState.UseOverride, FnState.UseCfg {
    record UseOverride(HostOverride override) implements FnState {
        public UseOverride {
            Objects.requireNonNull(override, "override");
        }
    }

    record UseCfg(Cfg cfg, Postdominators postdoms) implements FnState {
        public UseCfg {
            Objects.requireNonNull(cfg, "cfg");
            Objects.requireNonNull(postdoms, "postdoms");
        }
    }
}
