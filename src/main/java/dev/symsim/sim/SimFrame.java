package dev.symsim.sim;

import dev.symsim.backend.ProgramLoc;
import dev.symsim.cfg.Block;
import dev.symsim.cfg.BlockId;
import dev.symsim.cfg.Cfg;
import dev.symsim.cfg.Postdominators;
import java.util.Objects;
import java.util.Optional;

/**
 * 调用栈上的一个活动帧。帧不可变：每一步控制流都会整体替换当前帧。
 */
public sealed interface SimFrame permits SimFrame.OverrideFrame, SimFrame.CrucibleFrame, SimFrame.ReturnFrame {
    /** A host override being executed, with its argument registers. */
    record OverrideFrame(String name, RegMap args) implements SimFrame {
        public OverrideFrame {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(args, "args");
        }
    }

    /** A CFG activation positioned at statement {@code pc} of {@code block}. */
    record CrucibleFrame(Cfg cfg, Postdominators postdoms, BlockId block, int pc, RegMap regs) implements SimFrame {
        public CrucibleFrame {
            Objects.requireNonNull(cfg, "cfg");
            Objects.requireNonNull(postdoms, "postdoms");
            Objects.requireNonNull(block, "block");
            Objects.requireNonNull(regs, "regs");
            if (block.index() >= cfg.blockCount()) {
                throw new IllegalArgumentException("block " + block + " out of range in `" + cfg.handle().name() + "`");
            }
            if (pc < 0) {
                throw new IllegalArgumentException("pc must be >= 0");
            }
        }

        static CrucibleFrame entry(Cfg cfg, Postdominators postdoms, RegMap args) throws SimulatorError {
            CrucibleFrame f = new CrucibleFrame(cfg, postdoms, cfg.entry(), 0, RegMap.empty());
            return f.setBlock(cfg.entry(), args);
        }

        public Block currentBlock() {
            return cfg.blocks().get(block.index());
        }

        /** Moves to the start of {@code target}; the jump arguments become its registers. */
        public CrucibleFrame setBlock(BlockId target, RegMap args) throws SimulatorError {
            Block dst =
                    cfg.block(target)
                            .orElseThrow(
                                    () ->
                                            new SimulatorError.InvalidState(
                                                    "jump to unknown block " + target + " in `" + cfg.handle().name()
                                                            + "`"));
            if (!dst.paramTypes().equals(args.types())) {
                throw new SimulatorError.InvalidState(
                        "block " + target + " of `" + cfg.handle().name() + "` expects " + dst.paramTypes()
                                + " but got " + args.types());
            }
            return new CrucibleFrame(cfg, postdoms, target, 0, args);
        }

        public CrucibleFrame extend(RegEntry value) {
            return new CrucibleFrame(cfg, postdoms, block, pc, regs.append(value));
        }

        public CrucibleFrame withPc(int newPc) {
            return new CrucibleFrame(cfg, postdoms, block, newPc, regs);
        }

        public ProgramLoc programLoc() {
            return new ProgramLoc(cfg.handle().name(), block + ":" + pc);
        }

        public ProgramLoc blockLoc(BlockId id) {
            return new ProgramLoc(cfg.handle().name(), id.toString());
        }

        /** Where branches leaving the current block meet again. */
        public BranchTarget postdomTarget() {
            Optional<BlockId> pd = postdoms.immediate(block);
            if (pd.isPresent()) {
                return new BranchTarget.BlockTarget(pd.get());
            }
            return new BranchTarget.ReturnTarget();
        }

        @Override
        public String toString() {
            return "CrucibleFrame[" + programLoc() + ", regs=" + regs.entries() + "]";
        }
    }

    /** A CFG that has produced its return value and is waiting for pending merges. */
    record ReturnFrame(RegEntry value) implements SimFrame {
        public ReturnFrame {
            Objects.requireNonNull(value, "value");
        }
    }
}
