package org.calista.flowsight.train.knowledge.kernel;

import org.calista.flowsight.train.knowledge.FactSchema;
import org.calista.flowsight.train.knowledge.ScenarioCategory;
import org.calista.flowsight.train.knowledge.ScenarioFact;
import org.calista.flowsight.train.knowledge.SyncPrimitiveFact;

import java.util.List;

/**
 * Flat scenario tables (module lifecycle, memory, scheduler, network RX, power) and the
 * synchronization primitives.
 */
final class KernelScenarioFacts {
    private KernelScenarioFacts() {}

    static void register(FactSchema.Builder schema) {
        moduleLifecycle(schema);
        memory(schema);
        scheduler(schema);
        networkRx(schema);
        power(schema);
        synchronization(schema);
    }

    /** insmod / rmmod. */
    private static void moduleLifecycle(FactSchema.Builder schema) {
        schema.add(new ScenarioFact(ScenarioCategory.MODULE_LIFECYCLE, "insmod",
                "模块加载",
                null,
                List.of(
                        "sys_init_module / sys_finit_module (kernel/module.c)",
                        "load_module",
                        "do_init_module",
                        "mod->init() = module_init 指定的函数"),
                "insmod 返回时，module_init 已执行完毕，但 probe 可能还没调用"));
        schema.add(new ScenarioFact(ScenarioCategory.MODULE_LIFECYCLE, "rmmod",
                "模块卸载",
                null,
                List.of(
                        "sys_delete_module (kernel/module.c)",
                        "mod->exit() = module_exit 指定的函数",
                        "free_module"),
                "rmmod 会先调用 disconnect/remove（如果设备存在），再调用 exit"));
    }

    /** Allocation paths and the page fault path. */
    private static void memory(FactSchema.Builder schema) {
        schema.add(new ScenarioFact(ScenarioCategory.MEMORY, "kmalloc",
                "内核小内存分配",
                "进程上下文（GFP_KERNEL）或中断上下文（GFP_ATOMIC）",
                List.of(
                        "kmalloc (include/linux/slab.h)",
                        "__kmalloc",
                        "slab_alloc / slub_alloc",
                        "从 slab 缓存分配"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.MEMORY, "vmalloc",
                "虚拟连续内存分配",
                "只能在进程上下文，可能睡眠",
                List.of(
                        "vmalloc (mm/vmalloc.c)",
                        "__vmalloc_node",
                        "分配多个物理页",
                        "映射到虚拟地址空间"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.MEMORY, "page_fault",
                "缺页中断",
                "中断上下文转进程上下文",
                List.of(
                        "CPU 缺页异常",
                        "do_page_fault (arch/x86/mm/fault.c)",
                        "handle_mm_fault (mm/memory.c)",
                        "handle_pte_fault",
                        "do_anonymous_page / do_fault",
                        "分配物理页并映射"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.MEMORY, "dma_alloc",
                "DMA 内存分配",
                "进程上下文",
                List.of(
                        "dma_alloc_coherent (kernel/dma/mapping.c)",
                        "dma_direct_alloc / iommu_dma_alloc",
                        "分配物理连续内存",
                        "返回物理地址和虚拟地址"),
                null));
    }

    /** Scheduler entry points. */
    private static void scheduler(FactSchema.Builder schema) {
        schema.add(new ScenarioFact(ScenarioCategory.SCHEDULER, "timer_interrupt",
                "时钟中断触发调度检查",
                null,
                List.of(
                        "时钟中断 (arch/x86/kernel/time.c)",
                        "tick_handle_periodic / tick_nohz_handler",
                        "update_process_times",
                        "scheduler_tick (kernel/sched/core.c)",
                        "curr->sched_class->task_tick()",
                        "设置 TIF_NEED_RESCHED 标志"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.SCHEDULER, "voluntary_schedule",
                "主动调度（睡眠等待）",
                null,
                List.of(
                        "schedule() (kernel/sched/core.c)",
                        "__schedule",
                        "pick_next_task",
                        "context_switch",
                        "switch_to (arch/x86/kernel/process.c)"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.SCHEDULER, "wait_event",
                "等待事件",
                null,
                List.of(
                        "wait_event / wait_event_interruptible",
                        "prepare_to_wait",
                        "schedule()",
                        "被唤醒后 finish_wait"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.SCHEDULER, "wake_up",
                "唤醒进程",
                null,
                List.of(
                        "wake_up / wake_up_interruptible",
                        "__wake_up_common",
                        "try_to_wake_up (kernel/sched/core.c)",
                        "ttwu_queue",
                        "设置进程为 TASK_RUNNING"),
                null));
    }

    /** Packet receive: legacy irq vs. NAPI. */
    private static void networkRx(FactSchema.Builder schema) {
        schema.add(new ScenarioFact(ScenarioCategory.NETWORK_RX, "traditional_irq",
                "传统中断收包",
                null,
                List.of(
                        "网卡中断",
                        "do_IRQ (arch/x86/kernel/irq.c)",
                        "handle_irq",
                        "驱动中断处理函数",
                        "netif_rx (net/core/dev.c)",
                        "enqueue_to_backlog",
                        "NET_RX_SOFTIRQ 软中断",
                        "net_rx_action",
                        "协议栈处理"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.NETWORK_RX, "napi_poll",
                "NAPI 轮询收包（高性能）",
                null,
                List.of(
                        "网卡中断",
                        "驱动中断处理函数",
                        "napi_schedule (include/linux/netdevice.h)",
                        "禁用中断",
                        "NET_RX_SOFTIRQ 软中断",
                        "net_rx_action (net/core/dev.c)",
                        "napi_poll",
                        "驱动 poll 函数",
                        "napi_gro_receive",
                        "netif_receive_skb",
                        "协议栈处理"),
                null));
    }

    /** System and runtime power management. */
    private static void power(FactSchema.Builder schema) {
        schema.add(new ScenarioFact(ScenarioCategory.POWER, "system_suspend",
                "系统休眠",
                null,
                List.of(
                        "echo mem > /sys/power/state",
                        "pm_suspend (kernel/power/suspend.c)",
                        "enter_state",
                        "suspend_prepare",
                        "suspend_devices_and_enter",
                        "dpm_suspend_start",
                        "dpm_suspend",
                        "遍历设备调用 dev->driver->pm->suspend()"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.POWER, "system_resume",
                "系统唤醒",
                null,
                List.of(
                        "唤醒事件",
                        "dpm_resume",
                        "遍历设备调用 dev->driver->pm->resume()",
                        "resume_finish"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.POWER, "runtime_suspend",
                "运行时挂起（单个设备）",
                null,
                List.of(
                        "pm_runtime_put (drivers/base/power/runtime.c)",
                        "rpm_idle",
                        "rpm_suspend",
                        "dev->driver->pm->runtime_suspend()"),
                null));
        schema.add(new ScenarioFact(ScenarioCategory.POWER, "runtime_resume",
                "运行时恢复（单个设备）",
                null,
                List.of(
                        "pm_runtime_get (drivers/base/power/runtime.c)",
                        "rpm_resume",
                        "dev->driver->pm->runtime_resume()"),
                null));
    }

    private static void synchronization(FactSchema.Builder schema) {
        schema.add(SyncPrimitiveFact.builder("mutex")
                .description("互斥锁（可睡眠）")
                .lockOps("mutex_lock", "mutex_lock_interruptible")
                .unlockOps("mutex_unlock")
                .context("只能在进程上下文")
                .contendedChain(
                        "mutex_lock (kernel/locking/mutex.c)",
                        "__mutex_lock",
                        "mutex_optimistic_spin (尝试自旋)",
                        "失败则 schedule_preempt_disabled",
                        "进程睡眠",
                        "持有者 unlock 后被唤醒")
                .build());

        schema.add(SyncPrimitiveFact.builder("spinlock")
                .description("自旋锁（不可睡眠）")
                .lockOps("spin_lock", "spin_lock_irqsave", "spin_lock_bh")
                .unlockOps("spin_unlock", "spin_unlock_irqrestore", "spin_unlock_bh")
                .context("任何上下文")
                .note("spin_lock_irqsave 用于中断上下文")
                .build());

        schema.add(SyncPrimitiveFact.builder("rwlock")
                .description("读写锁")
                .lockOps("read_lock", "write_lock")
                .unlockOps("read_unlock", "write_unlock")
                .context("任何上下文（如用 _irqsave 变体）")
                .build());

        schema.add(SyncPrimitiveFact.builder("semaphore")
                .description("信号量（可睡眠）")
                .lockOps("down", "down_interruptible")
                .unlockOps("up")
                .context("进程上下文")
                .build());
    }
}
