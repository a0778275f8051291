package org.calista.flowsight.train.synth;

import org.calista.flowsight.train.knowledge.AsyncMechanismFact;
import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;

import java.util.Map;

/**
 * CodeSkeletons — illustrative C snippets paired with synthesized questions.
 *
 * <p>
 * Callback skeletons name the handler {@code my_<callback>} and bind it in the framework's
 * ops/driver structure. Unknown frameworks get a generic table, so no callback record is
 * ever emitted without input. Templates use {@code $CB}, {@code $FW} style tokens.
 * </p>
 */
public final class CodeSkeletons {

    /** Handler signature, body tail and binding table of one framework. */
    private record Frame(String signature, String tail, String table) {}

    private static final String RETURN_0 = "    return 0;\n";

    // ---------------------------------------------------------------------
    // Callback frames
    // ---------------------------------------------------------------------

    private static final Map<String, Frame> FRAMEWORKS = Map.of(
            "usb_driver", new Frame(
                    "static int my_$CB(struct usb_interface *intf, const struct usb_device_id *id)",
                    RETURN_0,
                    """
                    static struct usb_driver my_driver = {
                        .name = "my_usb_driver",
                        .$CB = my_$CB,
                        .id_table = my_id_table,
                    };

                    module_usb_driver(my_driver);"""),
            "platform_driver", new Frame(
                    "static int my_$CB(struct platform_device *pdev)",
                    RETURN_0,
                    """
                    static struct platform_driver my_driver = {
                        .driver = {
                            .name = "my_platform_driver",
                        },
                        .$CB = my_$CB,
                    };

                    module_platform_driver(my_driver);"""),
            "pci_driver", new Frame(
                    "static int my_$CB(struct pci_dev *pdev, const struct pci_device_id *id)",
                    RETURN_0,
                    """
                    static struct pci_driver my_driver = {
                        .name = "my_pci_driver",
                        .id_table = my_pci_ids,
                        .$CB = my_$CB,
                    };

                    module_pci_driver(my_driver);"""),
            "i2c_driver", new Frame(
                    "static int my_$CB(struct i2c_client *client)",
                    RETURN_0,
                    """
                    static struct i2c_driver my_driver = {
                        .driver = {
                            .name = "my_i2c_driver",
                        },
                        .$CB = my_$CB,
                        .id_table = my_i2c_ids,
                    };

                    module_i2c_driver(my_driver);"""),
            "spi_driver", new Frame(
                    "static int my_$CB(struct spi_device *spi)",
                    RETURN_0,
                    """
                    static struct spi_driver my_driver = {
                        .driver = {
                            .name = "my_spi_driver",
                        },
                        .$CB = my_$CB,
                    };

                    module_spi_driver(my_driver);"""),
            "file_operations", new Frame(
                    "static int my_$CB(struct inode *inode, struct file *filp)",
                    RETURN_0,
                    """
                    static struct file_operations my_fops = {
                        .owner = THIS_MODULE,
                        .$CB = my_$CB,
                    };"""),
            "net_device_ops", new Frame(
                    "static int my_$CB(struct net_device *ndev)",
                    RETURN_0,
                    """
                    static const struct net_device_ops my_netdev_ops = {
                        .$CB = my_$CB,
                    };

                    /* probe: ndev->netdev_ops = &my_netdev_ops; */"""),
            "block_device_operations", new Frame(
                    "static int my_$CB(struct gendisk *disk, blk_mode_t mode)",
                    RETURN_0,
                    """
                    static const struct block_device_operations my_bdops = {
                        .owner = THIS_MODULE,
                        .$CB = my_$CB,
                    };"""),
            "blk_mq_ops", new Frame(
                    "static blk_status_t my_$CB(struct blk_mq_hw_ctx *hctx, const struct blk_mq_queue_data *bd)",
                    "    return BLK_STS_OK;\n",
                    """
                    static const struct blk_mq_ops my_mq_ops = {
                        .$CB = my_$CB,
                    };""")
    );

    /** Callbacks whose prototype differs from the framework default, keyed "framework.callback". */
    private static final Map<String, Frame> SIGNATURES = Map.ofEntries(
            Map.entry("usb_driver.disconnect", new Frame(
                    "static void my_disconnect(struct usb_interface *intf)", "", null)),
            Map.entry("usb_driver.suspend", new Frame(
                    "static int my_suspend(struct usb_interface *intf, pm_message_t message)", RETURN_0, null)),
            Map.entry("usb_driver.resume", new Frame(
                    "static int my_resume(struct usb_interface *intf)", RETURN_0, null)),
            Map.entry("pci_driver.remove", new Frame(
                    "static void my_remove(struct pci_dev *pdev)", "", null)),
            Map.entry("file_operations.read", new Frame(
                    "static ssize_t my_read(struct file *filp, char __user *buf, size_t count, loff_t *ppos)",
                    RETURN_0, null)),
            Map.entry("file_operations.write", new Frame(
                    "static ssize_t my_write(struct file *filp, const char __user *buf, size_t count, loff_t *ppos)",
                    "    return count;\n", null)),
            Map.entry("file_operations.unlocked_ioctl", new Frame(
                    "static long my_unlocked_ioctl(struct file *filp, unsigned int cmd, unsigned long arg)",
                    RETURN_0, null)),
            Map.entry("file_operations.mmap", new Frame(
                    "static int my_mmap(struct file *filp, struct vm_area_struct *vma)", RETURN_0, null)),
            Map.entry("file_operations.poll", new Frame(
                    "static __poll_t my_poll(struct file *filp, poll_table *wait)", RETURN_0, null)),
            Map.entry("file_operations.fsync", new Frame(
                    "static int my_fsync(struct file *filp, loff_t start, loff_t end, int datasync)", RETURN_0, null)),
            Map.entry("net_device_ops.ndo_start_xmit", new Frame(
                    "static netdev_tx_t my_ndo_start_xmit(struct sk_buff *skb, struct net_device *ndev)",
                    "    return NETDEV_TX_OK;\n", null)),
            Map.entry("net_device_ops.ndo_set_rx_mode", new Frame(
                    "static void my_ndo_set_rx_mode(struct net_device *ndev)", "", null)),
            Map.entry("block_device_operations.release", new Frame(
                    "static void my_release(struct gendisk *disk)", "", null)),
            Map.entry("block_device_operations.ioctl", new Frame(
                    "static int my_ioctl(struct block_device *bdev, blk_mode_t mode, unsigned int cmd, unsigned long arg)",
                    RETURN_0, null)),
            Map.entry("blk_mq_ops.complete", new Frame(
                    "static void my_complete(struct request *rq)", "", null))
    );

    private static final Frame GENERIC = new Frame(
            "static int my_$CB(void *data)",
            RETURN_0,
            """
            static struct $FW my_ops = {
                .$CB = my_$CB,
            };""");

    public String callback(CallbackFact fact) {
        Frame frame = FRAMEWORKS.getOrDefault(fact.framework, GENERIC);
        Frame proto = SIGNATURES.getOrDefault(fact.framework + "." + fact.callback, frame);

        String text = proto.signature() + "\n"
                + "{\n"
                + "    printk(\"my_$CB called\\n\");\n"
                + proto.tail()
                + "}\n\n"
                + frame.table();
        return text.replace("$FW", fact.framework).replace("$CB", fact.callback);
    }

    // ---------------------------------------------------------------------
    // Deferred execution
    // ---------------------------------------------------------------------

    private static final Map<String, String> ASYNC = Map.of(
            "workqueue", """
                    static void my_work_handler(struct work_struct *work)
                    {
                        struct my_device *dev = container_of(work, struct my_device, work);
                        // 耗时操作
                        printk("Work executed\\n");
                    }

                    static int my_probe(struct platform_device *pdev)
                    {
                        struct my_device *dev = devm_kzalloc(&pdev->dev, sizeof(*dev), GFP_KERNEL);
                        INIT_WORK(&dev->work, my_work_handler);
                        return 0;
                    }

                    static irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        struct my_device *dev = dev_id;
                        schedule_work(&dev->work);
                        return IRQ_HANDLED;
                    }""",
            "timer", """
                    static void my_timer_callback(struct timer_list *t)
                    {
                        struct my_device *dev = from_timer(dev, t, timer);
                        printk("Timer expired\\n");
                        mod_timer(&dev->timer, jiffies + HZ);  // 重新启动
                    }

                    static int my_probe(struct platform_device *pdev)
                    {
                        struct my_device *dev = devm_kzalloc(&pdev->dev, sizeof(*dev), GFP_KERNEL);
                        timer_setup(&dev->timer, my_timer_callback, 0);
                        mod_timer(&dev->timer, jiffies + HZ);  // 1秒后触发
                        return 0;
                    }""",
            "tasklet", """
                    static void my_tasklet_handler(struct tasklet_struct *t)
                    {
                        struct my_device *dev = from_tasklet(dev, t, tasklet);
                        printk("Tasklet executed\\n");
                    }

                    static int my_probe(struct platform_device *pdev)
                    {
                        struct my_device *dev = devm_kzalloc(&pdev->dev, sizeof(*dev), GFP_KERNEL);
                        tasklet_setup(&dev->tasklet, my_tasklet_handler);
                        return 0;
                    }

                    static irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        struct my_device *dev = dev_id;
                        tasklet_schedule(&dev->tasklet);
                        return IRQ_HANDLED;
                    }""",
            "irq", """
                    static irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        struct my_device *dev = dev_id;
                        // 快速处理，不能睡眠！
                        u32 status = readl(dev->regs + STATUS_REG);
                        writel(status, dev->regs + STATUS_REG);  // 清除中断
                        return IRQ_HANDLED;
                    }

                    static int my_probe(struct platform_device *pdev)
                    {
                        struct my_device *dev = devm_kzalloc(&pdev->dev, sizeof(*dev), GFP_KERNEL);
                        int irq = platform_get_irq(pdev, 0);
                        devm_request_irq(&pdev->dev, irq, my_irq_handler, 0, "my_device", dev);
                        return 0;
                    }"""
    );

    /** Hand-written snippet where one exists, otherwise bind + trigger (+ wait) calls. */
    public String async(AsyncMechanismFact fact) {
        String authored = ASYNC.get(fact.mechanism);
        if (authored != null) return authored;

        String m = fact.mechanism;
        StringBuilder sb = new StringBuilder(512);
        sb.append("static void my_").append(m).append("_handler(void *data)\n")
                .append("{\n")
                .append("    printk(\"").append(m).append(" handler executed\\n\");\n")
                .append("}\n\n")
                .append("static int my_probe(struct platform_device *pdev)\n")
                .append("{\n")
                .append("    struct my_device *dev = devm_kzalloc(&pdev->dev, sizeof(*dev), GFP_KERNEL);\n");
        if (!fact.bindOps.isEmpty()) {
            sb.append("    ").append(fact.bindOps.get(0))
                    .append("(&dev->").append(m).append(", my_").append(m).append("_handler);\n");
        }
        sb.append("    return 0;\n")
                .append("}");

        if (!fact.triggerOps.isEmpty()) {
            sb.append("\n\nstatic void my_trigger(struct my_device *dev)\n")
                    .append("{\n")
                    .append("    ").append(fact.triggerOps.get(0)).append("(&dev->").append(m).append(");\n")
                    .append("}");
        } else {
            sb.append("\n\n// my_").append(m).append("_handler 由硬件事件触发");
        }

        if (!fact.waitOps.isEmpty()) {
            sb.append("\n\nstatic int my_wait(struct my_device *dev)\n")
                    .append("{\n")
                    .append("    ").append(fact.waitOps.get(0)).append("(&dev->").append(m).append(");\n")
                    .append("    return 0;\n")
                    .append("}");
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------------
    // Flat scenarios
    // ---------------------------------------------------------------------

    static final String SCHEDULER_PLACEHOLDER = "// 进程调度相关代码";

    private static final String MODULE = """
            static int __init my_init(void)
            {
                printk("Module loaded\\n");
                return usb_register(&my_driver);
            }

            static void __exit my_exit(void)
            {
                usb_deregister(&my_driver);
                printk("Module unloaded\\n");
            }

            module_init(my_init);
            module_exit(my_exit);""";

    private static final Map<String, String> MEMORY = Map.of(
            "kmalloc", """
                    struct my_device *dev = kmalloc(sizeof(*dev), GFP_KERNEL);
                    if (!dev)
                        return -ENOMEM;""",
            "vmalloc", """
                    void *buf = vmalloc(64 * PAGE_SIZE);
                    if (!buf)
                        return -ENOMEM;
                    /* ... */
                    vfree(buf);""",
            "page_fault", """
                    // 用户空间 mmap 后首次访问
                    char *buf = mmap(NULL, 4096, PROT_READ|PROT_WRITE, MAP_ANONYMOUS|MAP_PRIVATE, -1, 0);
                    buf[0] = 'A';  // 触发缺页中断""",
            "dma_alloc", """
                    dma_addr_t dma_handle;
                    void *cpu_addr = dma_alloc_coherent(&pdev->dev, SZ_4K, &dma_handle, GFP_KERNEL);
                    if (!cpu_addr)
                        return -ENOMEM;"""
    );

    private static final Map<String, String> NETWORK = Map.of(
            "traditional_irq", """
                    static irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        struct net_device *ndev = dev_id;
                        struct sk_buff *skb = my_receive_packet(ndev);
                        if (skb)
                            netif_rx(skb);
                        return IRQ_HANDLED;
                    }""",
            "napi_poll", """
                    static int my_poll(struct napi_struct *napi, int budget)
                    {
                        struct my_device *dev = container_of(napi, struct my_device, napi);
                        int done = 0;

                        while (done < budget) {
                            struct sk_buff *skb = my_receive_packet(dev);
                            if (!skb)
                                break;
                            napi_gro_receive(napi, skb);
                            done++;
                        }

                        if (done < budget) {
                            napi_complete_done(napi, done);
                            my_enable_irq(dev);  // 重新使能中断
                        }
                        return done;
                    }

                    static irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        struct my_device *dev = dev_id;
                        my_disable_irq(dev);
                        napi_schedule(&dev->napi);
                        return IRQ_HANDLED;
                    }"""
    );

    public String scenario(ScenarioFact fact) {
        return switch (fact.category) {
            case MODULE_LIFECYCLE -> MODULE;
            case MEMORY -> MEMORY.getOrDefault(fact.scenario, "");
            case SCHEDULER -> SCHEDULER_PLACEHOLDER;
            case NETWORK_RX -> NETWORK.getOrDefault(fact.scenario, "");
            case POWER -> power(fact.scenario);
        };
    }

    private static String power(String operation) {
        boolean runtime = operation.startsWith("runtime_");
        boolean resume = operation.endsWith("resume");
        String suspendFn = runtime ? "my_runtime_suspend" : "my_suspend";
        String resumeFn = runtime ? "my_runtime_resume" : "my_resume";

        String body = resume
                ? "static int " + resumeFn + "(struct device *dev)\n"
                + "{\n"
                + "    struct my_device *mydev = dev_get_drvdata(dev);\n"
                + "    // 恢复状态，重新启动设备\n"
                + "    my_restore_state(mydev);\n"
                + "    my_start_device(mydev);\n"
                + "    return 0;\n"
                + "}\n\n"
                : "static int " + suspendFn + "(struct device *dev)\n"
                + "{\n"
                + "    struct my_device *mydev = dev_get_drvdata(dev);\n"
                + "    // 保存状态，停止设备\n"
                + "    my_save_state(mydev);\n"
                + "    my_stop_device(mydev);\n"
                + "    return 0;\n"
                + "}\n\n";

        String table = runtime
                ? "static const struct dev_pm_ops my_pm_ops = {\n"
                + "    SET_RUNTIME_PM_OPS(" + suspendFn + ", " + resumeFn + ", NULL)\n"
                + "};"
                : "static SIMPLE_DEV_PM_OPS(my_pm_ops, " + suspendFn + ", " + resumeFn + ");";
        return body + table;
    }

    // ---------------------------------------------------------------------
    // Synchronization
    // ---------------------------------------------------------------------

    private static final Map<String, String> SYNC = Map.of(
            "mutex", """
                    static DEFINE_MUTEX(my_mutex);

                    void my_function(void)
                    {
                        mutex_lock(&my_mutex);
                        // 临界区，可以睡眠
                        msleep(10);
                        mutex_unlock(&my_mutex);
                    }""",
            "spinlock", """
                    static DEFINE_SPINLOCK(my_lock);

                    irqreturn_t my_irq_handler(int irq, void *dev_id)
                    {
                        unsigned long flags;
                        spin_lock_irqsave(&my_lock, flags);
                        // 临界区，不能睡眠！
                        spin_unlock_irqrestore(&my_lock, flags);
                        return IRQ_HANDLED;
                    }""",
            "rwlock", """
                    static DEFINE_RWLOCK(my_rwlock);

                    int my_read_config(void)
                    {
                        int val;
                        read_lock(&my_rwlock);
                        val = my_config;
                        read_unlock(&my_rwlock);
                        return val;
                    }""",
            "semaphore", """
                    static DEFINE_SEMAPHORE(my_sem, 1);

                    int my_function(void)
                    {
                        if (down_interruptible(&my_sem))
                            return -ERESTARTSYS;
                        // 临界区，可以睡眠
                        up(&my_sem);
                        return 0;
                    }"""
    );

    public String sync(SyncPrimitiveFact fact) {
        String authored = SYNC.get(fact.primitive);
        if (authored != null) return authored;
        if (fact.lockOps.isEmpty() || fact.unlockOps.isEmpty()) return "";

        String var = "my_" + fact.primitive;
        return "void my_function(void)\n"
                + "{\n"
                + "    " + fact.lockOps.get(0) + "(&" + var + ");\n"
                + "    // 临界区\n"
                + "    " + fact.unlockOps.get(0) + "(&" + var + ");\n"
                + "}";
    }
}
