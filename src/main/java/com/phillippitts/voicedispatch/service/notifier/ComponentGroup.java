package com.phillippitts.voicedispatch.service.notifier;

import com.phillippitts.voicedispatch.service.component.Component;
import com.phillippitts.voicedispatch.service.component.Input;
import com.phillippitts.voicedispatch.service.component.Output;
import com.phillippitts.voicedispatch.service.handler.Service;

/** Role of a component, used to aggregate activity for indicators. */
public enum ComponentGroup {
    INPUT, SERVICE, OUTPUT, OTHER;

    public static ComponentGroup of(Component component) {
        if (component instanceof Input) {
            return INPUT;
        }
        if (component instanceof Service) {
            return SERVICE;
        }
        if (component instanceof Output) {
            return OUTPUT;
        }
        return OTHER;
    }
}
