package com.novalang.cfg.pass;

import com.novalang.cfg.mir.MalformedMirException;
import com.novalang.cfg.mir.MirModule;
import com.novalang.cfg.pass.mir.BlockMerging;
import com.novalang.cfg.pass.mir.DeadBlockElimination;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MIR Pass 管线。按顺序执行各 pass，可选在每个 pass 之后做结构校验。
 *
 * <p>环境变量：{@code NOVA_VERIFY_MIR=1} 开启逐 pass 校验，
 * {@code NOVA_DUMP_MIR=1} 在管线结束后把 MIR 打印到 stderr。</p>
 */
public class PassPipeline {

    private static final Logger LOG = Logger.getLogger(PassPipeline.class.getName());

    private final List<MirPass> mirPasses = new ArrayList<>();
    private boolean verifyEachPass = "1".equals(System.getenv("NOVA_VERIFY_MIR"));

    public PassPipeline() {
    }

    /**
     * 创建默认管线。
     */
    public static PassPipeline createDefault() {
        PassPipeline pipeline = new PassPipeline();
        pipeline.addMirPass(new DeadBlockElimination());
        pipeline.addMirPass(new BlockMerging());
        pipeline.addMirPass(new DeadBlockElimination());  // 清理合并后的不可达块
        return pipeline;
    }

    public void addMirPass(MirPass pass) {
        mirPasses.add(pass);
    }

    public List<MirPass> getMirPasses() { return Collections.unmodifiableList(mirPasses); }

    public boolean isVerifyEachPass() { return verifyEachPass; }

    public void setVerifyEachPass(boolean verifyEachPass) {
        this.verifyEachPass = verifyEachPass;
    }

    /**
     * 依次执行所有 pass。
     *
     * @throws MalformedMirException 开启校验且某个 pass 之后结构不完整
     */
    public MirModule run(MirModule module) {
        if (verifyEachPass) {
            verify(module, "<input>");
        }
        for (MirPass pass : mirPasses) {
            LOG.fine("运行 MIR pass: " + pass.getName());
            module = pass.run(module);
            if (verifyEachPass) {
                verify(module, pass.getName());
            }
        }

        // MIR dump（设置 NOVA_DUMP_MIR=1 环境变量启用）
        if ("1".equals(System.getenv("NOVA_DUMP_MIR"))) {
            System.err.println("===== MIR DUMP =====");
            System.err.print(module);
            System.err.println("===== END MIR DUMP =====");
        }
        return module;
    }

    private void verify(MirModule module, String after) {
        List<String> problems = MirVerifier.verify(module);
        if (problems.isEmpty()) {
            return;
        }
        MalformedMirException e = new MalformedMirException("pass " + after + " 之后 MIR 校验失败:\n  "
                + String.join("\n  ", problems));
        LOG.log(Level.WARNING, "MIR 校验失败: " + module.getName(), e);
        throw e;
    }
}
