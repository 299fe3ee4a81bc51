package alertpipeline.channel;

import alertpipeline.model.Alert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 内存通道 - 保存最近发送的告警, 供查看和测试使用
 */
public class InMemoryAlertChannel extends AbstractAlertChannel {

    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final Deque<String> messages = new ArrayDeque<>();
    private int capacity = 1000;
    private long sendCount;

    @Override
    protected void doInitialize(ChannelConfig config) {
        synchronized (alerts) {
            capacity = Math.max(1, config.getInt("capacity", 1000));
        }
    }

    @Override
    protected void doSend(Alert alert, String formatted) {
        synchronized (alerts) {
            alerts.addLast(alert);
            messages.addLast(formatted);
            while (alerts.size() > capacity) {
                alerts.pollFirst();
                messages.pollFirst();
            }
            sendCount++;
        }
    }

    public List<Alert> getAlerts() {
        synchronized (alerts) {
            return new ArrayList<>(alerts);
        }
    }

    public List<String> getMessages() {
        synchronized (alerts) {
            return new ArrayList<>(messages);
        }
    }

    public long getSendCount() {
        synchronized (alerts) {
            return sendCount;
        }
    }

    public void clear() {
        synchronized (alerts) {
            alerts.clear();
            messages.clear();
        }
    }
}
