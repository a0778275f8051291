package org.calista.flowsight.train.knowledge.kernel;

import org.calista.flowsight.train.knowledge.AsyncMechanismFact;
import org.calista.flowsight.train.knowledge.FactSchema;

/**
 * Deferred execution mechanisms: how a handler gets bound, what fires it and in which context it runs.
 */
final class AsyncMechanismFacts {
    private AsyncMechanismFacts() {}

    static void register(FactSchema.Builder schema) {
        schema.add(AsyncMechanismFact.builder("workqueue")
                .bindOps("INIT_WORK", "INIT_DELAYED_WORK", "DECLARE_WORK")
                .triggerOps("schedule_work", "queue_work", "schedule_delayed_work", "queue_delayed_work")
                .context("进程上下文（可睡眠）")
                .description("工作队列，用于延迟执行耗时操作")
                .callChain(
                        "schedule_work (kernel/workqueue.c)",
                        "queue_work_on",
                        "insert_work",
                        "唤醒 kworker 线程",
                        "worker_thread",
                        "process_one_work",
                        "worker->current_func = work->func",
                        "work->func(work)")
                .typicalUse("中断下半部、延迟初始化、耗时 I/O")
                .flowSteps(
                        "probe 中调用 INIT_WORK 绑定处理函数",
                        "中断中调用 schedule_work 提交任务",
                        "schedule_work 立即返回，不等待执行",
                        "内核 kworker 线程稍后调度执行处理函数")
                .timeline("中断发生 → schedule_work → 立即返回 → ... → kworker 调度 → handler 执行")
                .build());

        schema.add(AsyncMechanismFact.builder("timer")
                .bindOps("timer_setup", "DEFINE_TIMER", "setup_timer")
                .triggerOps("mod_timer", "add_timer", "timer_reduce")
                .context("软中断上下文（不可睡眠）")
                .description("定时器，在指定时间后执行")
                .callChain(
                        "mod_timer (kernel/time/timer.c)",
                        "internal_add_timer",
                        "时钟中断",
                        "run_timer_softirq",
                        "expire_timers",
                        "call_timer_fn",
                        "timer->function(timer)")
                .typicalUse("超时处理、周期性任务、看门狗")
                .flowSteps(
                        "probe 中调用 timer_setup 绑定回调函数",
                        "mod_timer 设置定时器到期时间",
                        "定时器到期后，内核调用回调函数")
                .flowNote("回调在软中断上下文，不能睡眠！")
                .build());

        schema.add(AsyncMechanismFact.builder("hrtimer")
                .bindOps("hrtimer_init")
                .triggerOps("hrtimer_start", "hrtimer_start_range_ns")
                .context("硬中断上下文（不可睡眠）")
                .description("高精度定时器")
                .callChain(
                        "hrtimer_start (kernel/time/hrtimer.c)",
                        "enqueue_hrtimer",
                        "高精度时钟中断",
                        "hrtimer_interrupt",
                        "__hrtimer_run_queues",
                        "hrtimer_run_softirq (如果配置)",
                        "timer->function(timer)")
                .typicalUse("纳秒级精度定时、POSIX 定时器")
                .build());

        schema.add(AsyncMechanismFact.builder("tasklet")
                .bindOps("tasklet_init", "tasklet_setup", "DECLARE_TASKLET")
                .triggerOps("tasklet_schedule", "tasklet_hi_schedule")
                .context("软中断上下文（不可睡眠）")
                .description("软中断，优先级高于工作队列")
                .callChain(
                        "tasklet_schedule (include/linux/interrupt.h)",
                        "raise_softirq_irqoff(TASKLET_SOFTIRQ)",
                        "软中断处理",
                        "tasklet_action",
                        "tasklet->func(tasklet)")
                .typicalUse("中断下半部快速处理")
                .flowSteps(
                        "probe 中调用 tasklet_setup 绑定处理函数",
                        "中断中调用 tasklet_schedule 调度执行",
                        "中断返回后，软中断上下文执行 tasklet")
                .flowNote("优先级高于 workqueue，低于硬中断")
                .build());

        schema.add(AsyncMechanismFact.builder("irq")
                .bindOps("request_irq", "devm_request_irq", "request_threaded_irq")
                .context("硬中断上下文（不可睡眠，快速执行）")
                .description("硬件中断处理")
                .callChain(
                        "硬件产生中断信号",
                        "CPU 响应中断",
                        "do_IRQ (arch/x86/kernel/irq.c)",
                        "handle_irq",
                        "generic_handle_irq",
                        "handle_fasteoi_irq / handle_edge_irq",
                        "handle_irq_event",
                        "action->handler(irq, dev_id)")
                .typicalUse("硬件事件响应")
                .flowSteps(
                        "probe 中调用 request_irq 注册中断处理函数",
                        "硬件触发中断时，CPU 调用处理函数",
                        "必须快速执行，不能睡眠！")
                .build());

        schema.add(AsyncMechanismFact.builder("threaded_irq")
                .bindOps("request_threaded_irq", "devm_request_threaded_irq")
                .context("进程上下文（可睡眠）")
                .description("线程化中断处理")
                .callChain(
                        "硬件中断 → hardirq handler (快速)",
                        "返回 IRQ_WAKE_THREAD",
                        "唤醒 irq_thread",
                        "irq_thread_fn",
                        "action->thread_fn(irq, dev_id)")
                .typicalUse("需要睡眠的中断处理（如 I2C 通信）")
                .build());

        schema.add(AsyncMechanismFact.builder("softirq")
                .bindOps("open_softirq")
                .triggerOps("raise_softirq", "raise_softirq_irqoff")
                .context("软中断上下文（不可睡眠）")
                .description("软中断（最底层机制）")
                .callChain(
                        "raise_softirq (kernel/softirq.c)",
                        "中断返回时检查",
                        "irq_exit → invoke_softirq",
                        "do_softirq",
                        "__do_softirq",
                        "softirq_vec[nr].action()")
                .typicalUse("网络收发、块设备完成")
                .build());

        schema.add(AsyncMechanismFact.builder("completion")
                .bindOps("init_completion", "DECLARE_COMPLETION")
                .triggerOps("complete", "complete_all")
                .waitOps("wait_for_completion", "wait_for_completion_timeout")
                .context("wait 在进程上下文，complete 可在任何上下文")
                .description("同步等待机制")
                .callChain(
                        "wait_for_completion (kernel/sched/completion.c)",
                        "wait_for_common",
                        "schedule()",
                        "--- 另一方 ---",
                        "complete()",
                        "swake_up_locked",
                        "唤醒等待者")
                .typicalUse("等待异步操作完成")
                .build());

        schema.add(AsyncMechanismFact.builder("waitqueue")
                .bindOps("init_waitqueue_head", "DECLARE_WAIT_QUEUE_HEAD")
                .triggerOps("wake_up", "wake_up_interruptible", "wake_up_all")
                .waitOps("wait_event", "wait_event_interruptible", "wait_event_timeout")
                .context("wait 在进程上下文，wake_up 可在任何上下文")
                .description("等待队列")
                .callChain(
                        "wait_event (include/linux/wait.h)",
                        "prepare_to_wait",
                        "设置进程状态为 TASK_INTERRUPTIBLE",
                        "schedule()",
                        "--- 另一方 ---",
                        "wake_up()",
                        "__wake_up_common",
                        "唤醒等待进程")
                .typicalUse("等待条件满足")
                .build());

        schema.add(AsyncMechanismFact.builder("kthread")
                .bindOps("kthread_create", "kthread_run")
                .triggerOps("wake_up_process")
                .context("进程上下文（可睡眠）")
                .description("内核线程")
                .callChain(
                        "kthread_create (kernel/kthread.c)",
                        "kthread_create_on_node",
                        "创建 kthread 结构",
                        "唤醒 kthreadd",
                        "kthreadd → create_kthread",
                        "kernel_thread → kthread",
                        "threadfn(data)")
                .typicalUse("后台服务、周期性任务")
                .build());

        schema.add(AsyncMechanismFact.builder("rcu")
                .bindOps("call_rcu", "synchronize_rcu")
                .context("call_rcu 回调在软中断，synchronize_rcu 在进程上下文")
                .description("Read-Copy-Update 同步机制")
                .callChain(
                        "call_rcu (kernel/rcu/tree.c)",
                        "注册回调",
                        "等待宽限期",
                        "rcu_process_callbacks",
                        "rcu_do_batch",
                        "callback()")
                .typicalUse("无锁数据结构更新")
                .build());

        schema.add(AsyncMechanismFact.builder("notifier")
                .bindOps("blocking_notifier_chain_register", "atomic_notifier_chain_register")
                .triggerOps("blocking_notifier_call_chain", "atomic_notifier_call_chain")
                .context("blocking 在进程上下文，atomic 在任何上下文")
                .description("通知链机制")
                .callChain(
                        "blocking_notifier_call_chain (kernel/notifier.c)",
                        "down_read(&nh->rwsem)",
                        "notifier_call_chain",
                        "遍历链表调用每个 notifier_block->notifier_call")
                .typicalUse("内核子系统事件通知")
                .build());
    }
}
