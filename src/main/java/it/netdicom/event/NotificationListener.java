package it.netdicom.event;

@FunctionalInterface
public interface NotificationListener {

    void onEvent(Notification notification);
}
