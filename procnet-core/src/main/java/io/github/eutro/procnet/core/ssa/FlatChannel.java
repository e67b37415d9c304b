package io.github.eutro.procnet.core.ssa;

import io.github.eutro.procnet.core.types.Type;

/**
 * A globally named channel, declared at module scope.
 */
public final class FlatChannel extends ModuleSymbol {
    public final Type elementType;
    private boolean sendSupported = true;
    private boolean recvSupported = true;

    public FlatChannel(String name, Type elementType) {
        super(name);
        this.elementType = elementType;
    }

    public boolean isSendSupported() {
        return sendSupported;
    }

    public void setSendSupported(boolean sendSupported) {
        this.sendSupported = sendSupported;
    }

    public boolean isRecvSupported() {
        return recvSupported;
    }

    public void setRecvSupported(boolean recvSupported) {
        this.recvSupported = recvSupported;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("chan @").append(getName()).append(" : ").append(elementType).append(" [");
        if (sendSupported) sb.append("send");
        if (sendSupported && recvSupported) sb.append(", ");
        if (recvSupported) sb.append("recv");
        return sb.append(']').toString();
    }
}
