package org.calista.flowsight.train.knowledge.kernel;

import org.calista.flowsight.train.knowledge.CallbackFact;
import org.calista.flowsight.train.knowledge.FactSchema;

import java.util.List;

/**
 * Driver and ops-table callback facts: bus drivers (usb, platform, pci, i2c, spi),
 * file_operations, net_device_ops, block_device_operations and blk_mq_ops.
 */
final class DriverFrameworkFacts {
    private DriverFrameworkFacts() {}

    static void register(FactSchema.Builder schema) {
        schema.add(new CallbackFact("usb_driver", "probe",
                "USB 设备插入且 ID 匹配",
                "进程上下文（可睡眠）",
                List.of(
                        "usb_hub_port_connect (drivers/usb/core/hub.c)",
                        "usb_new_device",
                        "device_add (drivers/base/core.c)",
                        "bus_probe_device",
                        "driver_probe_device (drivers/base/dd.c)",
                        "really_probe",
                        "usb_probe_interface (drivers/usb/core/driver.c)",
                        "drv->probe()"),
                "不是 insmod 时调用，而是设备插入后异步调用"));
        schema.add(new CallbackFact("usb_driver", "disconnect",
                "USB 设备拔出",
                "进程上下文（可睡眠）",
                List.of(
                        "usb_disconnect (drivers/usb/core/hub.c)",
                        "device_del",
                        "bus_remove_device",
                        "drv->disconnect()"),
                null));
        schema.add(new CallbackFact("usb_driver", "suspend",
                "系统休眠或 USB 自动挂起",
                "进程上下文",
                List.of(
                        "pm_suspend",
                        "dpm_suspend",
                        "usb_suspend_interface",
                        "drv->suspend()"),
                null));
        schema.add(new CallbackFact("usb_driver", "resume",
                "系统唤醒或 USB 自动恢复",
                "进程上下文",
                List.of(
                        "pm_resume",
                        "dpm_resume",
                        "usb_resume_interface",
                        "drv->resume()"),
                null));
        schema.add(new CallbackFact("platform_driver", "probe",
                "设备树匹配 / platform_device_register / ACPI",
                "进程上下文",
                List.of(
                        "platform_device_add (drivers/base/platform.c)",
                        "device_add",
                        "bus_probe_device",
                        "really_probe (drivers/base/dd.c)",
                        "platform_drv_probe",
                        "drv->probe()"),
                null));
        schema.add(new CallbackFact("platform_driver", "remove",
                "设备移除或模块卸载",
                "进程上下文",
                List.of(
                        "platform_device_del",
                        "device_del",
                        "drv->remove()"),
                null));
        schema.add(new CallbackFact("platform_driver", "suspend",
                "系统休眠",
                "进程上下文",
                List.of(
                        "pm_suspend",
                        "dpm_suspend",
                        "platform_pm_suspend",
                        "drv->suspend()"),
                null));
        schema.add(new CallbackFact("platform_driver", "resume",
                "系统唤醒",
                "进程上下文",
                List.of(
                        "pm_resume",
                        "dpm_resume",
                        "platform_pm_resume",
                        "drv->resume()"),
                null));
        schema.add(new CallbackFact("pci_driver", "probe",
                "PCI 设备发现且 ID 匹配",
                "进程上下文",
                List.of(
                        "pci_device_add (drivers/pci/probe.c)",
                        "device_add",
                        "bus_probe_device",
                        "really_probe",
                        "pci_device_probe (drivers/pci/pci-driver.c)",
                        "drv->probe()"),
                null));
        schema.add(new CallbackFact("pci_driver", "remove",
                "PCI 设备移除或模块卸载",
                "进程上下文",
                List.of(
                        "pci_stop_and_remove_bus_device",
                        "device_del",
                        "drv->remove()"),
                null));
        schema.add(new CallbackFact("i2c_driver", "probe",
                "I2C 设备匹配（设备树/ACPI/手动注册）",
                "进程上下文",
                List.of(
                        "i2c_device_register (drivers/i2c/i2c-core-base.c)",
                        "device_add",
                        "bus_probe_device",
                        "really_probe",
                        "i2c_device_probe",
                        "drv->probe()"),
                null));
        schema.add(new CallbackFact("spi_driver", "probe",
                "SPI 设备匹配",
                "进程上下文",
                List.of(
                        "spi_add_device",
                        "device_add",
                        "bus_probe_device",
                        "drv->probe()"),
                null));
        schema.add(new CallbackFact("file_operations", "open",
                "用户调用 open() 系统调用",
                "进程上下文",
                List.of(
                        "sys_open / sys_openat (fs/open.c)",
                        "do_sys_open",
                        "do_filp_open",
                        "path_openat",
                        "vfs_open",
                        "do_dentry_open (fs/open.c)",
                        "f_op->open()"),
                null));
        schema.add(new CallbackFact("file_operations", "read",
                "用户调用 read() 系统调用",
                "进程上下文",
                List.of(
                        "sys_read (fs/read_write.c)",
                        "ksys_read",
                        "vfs_read",
                        "f_op->read() / f_op->read_iter()"),
                null));
        schema.add(new CallbackFact("file_operations", "write",
                "用户调用 write() 系统调用",
                "进程上下文",
                List.of(
                        "sys_write (fs/read_write.c)",
                        "ksys_write",
                        "vfs_write",
                        "f_op->write() / f_op->write_iter()"),
                null));
        schema.add(new CallbackFact("file_operations", "unlocked_ioctl",
                "用户调用 ioctl() 系统调用",
                "进程上下文",
                List.of(
                        "sys_ioctl (fs/ioctl.c)",
                        "do_vfs_ioctl",
                        "vfs_ioctl",
                        "f_op->unlocked_ioctl()"),
                null));
        schema.add(new CallbackFact("file_operations", "mmap",
                "用户调用 mmap() 系统调用",
                "进程上下文",
                List.of(
                        "sys_mmap (mm/mmap.c)",
                        "ksys_mmap_pgoff",
                        "vm_mmap_pgoff",
                        "do_mmap",
                        "mmap_region",
                        "call_mmap",
                        "f_op->mmap()"),
                "mmap 后首次访问会触发缺页中断"));
        schema.add(new CallbackFact("file_operations", "poll",
                "用户调用 poll()/select()/epoll_wait()",
                "进程上下文",
                List.of(
                        "sys_poll / sys_epoll_wait",
                        "do_poll / ep_poll",
                        "vfs_poll",
                        "f_op->poll()"),
                null));
        schema.add(new CallbackFact("file_operations", "release",
                "文件描述符关闭（最后一个引用）",
                "进程上下文",
                List.of(
                        "sys_close (fs/open.c)",
                        "__close_fd",
                        "filp_close",
                        "__fput",
                        "f_op->release()"),
                null));
        schema.add(new CallbackFact("file_operations", "fsync",
                "用户调用 fsync()/fdatasync()",
                "进程上下文",
                List.of(
                        "sys_fsync",
                        "vfs_fsync",
                        "f_op->fsync()"),
                null));
        schema.add(new CallbackFact("net_device_ops", "ndo_open",
                "ifconfig up / ip link set up",
                "进程上下文",
                List.of(
                        "dev_open (net/core/dev.c)",
                        "__dev_open",
                        "ops->ndo_open()"),
                null));
        schema.add(new CallbackFact("net_device_ops", "ndo_stop",
                "ifconfig down / ip link set down",
                "进程上下文",
                List.of(
                        "dev_close",
                        "__dev_close",
                        "ops->ndo_stop()"),
                null));
        schema.add(new CallbackFact("net_device_ops", "ndo_start_xmit",
                "数据包发送",
                "软中断上下文或进程上下文",
                List.of(
                        "send() / sendto() / sendmsg()",
                        "协议栈处理 (TCP/UDP/IP)",
                        "dev_queue_xmit (net/core/dev.c)",
                        "__dev_queue_xmit",
                        "dev_hard_start_xmit",
                        "ops->ndo_start_xmit()"),
                "高性能场景可能在软中断中调用"));
        schema.add(new CallbackFact("net_device_ops", "ndo_set_rx_mode",
                "设置多播/混杂模式",
                "进程上下文",
                List.of(
                        "dev_set_rx_mode",
                        "ops->ndo_set_rx_mode()"),
                null));
        schema.add(new CallbackFact("block_device_operations", "open",
                "打开块设备",
                "进程上下文",
                List.of(
                        "blkdev_open",
                        "bdev_open_by_dev",
                        "ops->open()"),
                null));
        schema.add(new CallbackFact("block_device_operations", "release",
                "关闭块设备",
                "进程上下文",
                List.of(
                        "blkdev_close",
                        "ops->release()"),
                null));
        schema.add(new CallbackFact("block_device_operations", "ioctl",
                "块设备 ioctl",
                "进程上下文",
                List.of(
                        "blkdev_ioctl",
                        "ops->ioctl()"),
                null));
        schema.add(new CallbackFact("blk_mq_ops", "queue_rq",
                "I/O 请求入队",
                "进程上下文或软中断",
                List.of(
                        "submit_bio (block/blk-core.c)",
                        "blk_mq_submit_bio",
                        "blk_mq_try_issue_directly / blk_mq_sched_insert_request",
                        "ops->queue_rq()"),
                null));
        schema.add(new CallbackFact("blk_mq_ops", "complete",
                "I/O 请求完成（通常由中断触发）",
                "中断上下文或软中断",
                List.of(
                        "硬件中断",
                        "blk_mq_complete_request (block/blk-mq.c)",
                        "ops->complete()"),
                null));
    }
}
