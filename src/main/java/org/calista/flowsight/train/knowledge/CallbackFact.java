package org.calista.flowsight.train.knowledge;

import java.util.List;

/**
 * CallbackFact — when a framework invokes one of its callback slots.
 *
 * <p>Example: {@code usb_driver.probe} fires when a USB device with a matching id is
 * plugged in, in process context, through {@code usb_new_device → ... → drv->probe()}.</p>
 */
public final class CallbackFact implements Fact {

    /** Owning framework (the ops/driver structure type), e.g. "usb_driver". */
    public final String framework;

    /** Callback slot name, e.g. "probe". */
    public final String callback;

    public final String trigger;

    /** Execution context label; may be null. */
    public final String context;

    /** Ordered, non-empty. */
    public final List<String> callChain;

    /** Optional caveat. */
    public final String note;

    public CallbackFact(String framework,
                        String callback,
                        String trigger,
                        String context,
                        List<String> callChain,
                        String note) {
        this.framework = Facts.required(framework, "CallbackFact.framework");
        this.callback = Facts.required(callback, "CallbackFact.callback");
        this.trigger = Facts.required(trigger, "CallbackFact.trigger");
        this.context = Facts.optional(context);
        this.callChain = Facts.nonEmptySteps(callChain, "CallbackFact.callChain");
        this.note = Facts.optional(note);
    }

    /** Name of the handler the synthesized snippets bind to this slot. */
    public String handlerName() {
        return "my_" + callback;
    }

    @Override
    public String id() {
        return "callback:" + framework + "." + callback;
    }

    @Override
    public FactKind kind() {
        return FactKind.CALLBACK;
    }

    @Override
    public String name() {
        return callback;
    }

    @Override
    public String toString() {
        return "CallbackFact{" + framework + "." + callback + ", steps=" + callChain.size() + '}';
    }
}
