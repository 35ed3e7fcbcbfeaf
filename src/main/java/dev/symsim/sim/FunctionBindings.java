package dev.symsim.sim;

import dev.symsim.cfg.Cfg;
import dev.symsim.cfg.CfgVerifier;
import dev.symsim.cfg.FnHandle;
import dev.symsim.cfg.Postdominators;
import dev.symsim.cfg.VerifyException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** 函数句柄到实现（宿主 override 或 CFG）的绑定表。 */
public final class FunctionBindings {
    private final Map<FnHandle, FnState> byHandle = new HashMap<>();

    public void registerOverride(FnHandle handle, HostOverride override) {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(override, "override");
        byHandle.put(handle, new FnState.UseOverride(override));
    }

    /** Verifies {@code cfg}, computes its postdominators and binds it to its handle. */
    public void registerCfg(Cfg cfg) throws VerifyException {
        Objects.requireNonNull(cfg, "cfg");
        CfgVerifier.verify(cfg);
        byHandle.put(cfg.handle(), new FnState.UseCfg(cfg, Postdominators.compute(cfg)));
    }

    public Optional<FnState> lookup(FnHandle handle) {
        Objects.requireNonNull(handle, "handle");
        return Optional.ofNullable(byHandle.get(handle));
    }
}
