package alertpipeline.channel;

import alertpipeline.model.Alert;
import alertpipeline.model.AlertSeverity;

import java.io.PrintStream;

/**
 * 控制台通道. ERROR 及以上写标准错误, 可通过 use_stderr 关闭
 */
public class ConsoleAlertChannel extends AbstractAlertChannel {

    private final PrintStream out;
    private final PrintStream err;
    private volatile boolean useStderr = true;

    public ConsoleAlertChannel() {
        this(System.out, System.err);
    }

    public ConsoleAlertChannel(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    protected void doInitialize(ChannelConfig config) {
        useStderr = config.getBoolean("use_stderr", true);
    }

    @Override
    protected void doSend(Alert alert, String formatted) {
        PrintStream target = useStderr && alert.getSeverity().isAtLeast(AlertSeverity.ERROR) ? err : out;
        target.println(formatted);
        target.flush();
    }
}
