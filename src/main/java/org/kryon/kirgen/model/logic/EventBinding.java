package org.kryon.kirgen.model.logic;

public class EventBinding {
    public int componentId = -1;
    public String eventType;
    public String handlerName;

    public boolean matches(int componentId, String eventType) {
        return this.componentId == componentId && eventType != null && eventType.equals(this.eventType);
    }
}
