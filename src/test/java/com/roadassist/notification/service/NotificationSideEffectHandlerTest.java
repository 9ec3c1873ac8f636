package com.roadassist.notification.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorKind;
import com.roadassist.notification.entity.Notification;
import com.roadassist.notification.entity.NotificationType;
import com.roadassist.notification.port.WorkshopAlertSender;
import com.roadassist.notification.repository.NotificationRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willAnswer;

@ExtendWith(MockitoExtension.class)
class NotificationSideEffectHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private WorkshopAlertSender workshopAlertSender;

    @Test
    @DisplayName("A stored draft becomes an unread notification for its recipient")
    void notificationDraft_IsStored() throws Exception {
        // Given
        willAnswer(inv -> inv.getArgument(0)).given(notificationRepository).save(any(Notification.class));
        NotificationSideEffectHandler handler = new NotificationSideEffectHandler(notificationRepository, objectMapper);
        String payload = objectMapper.writeValueAsString(new NotificationDraft(70L, "New Service Assignment",
                "You've been assigned a new Car service request in Sector 17", NotificationType.NEW_ASSIGNMENT, 1L));

        // When
        handler.apply(payload);

        // Then
        ArgumentCaptor<Notification> saved = ArgumentCaptor.forClass(Notification.class);
        then(notificationRepository).should().save(saved.capture());
        assertThat(saved.getValue().getUserId()).isEqualTo(70L);
        assertThat(saved.getValue().getType()).isEqualTo(NotificationType.NEW_ASSIGNMENT);
        assertThat(saved.getValue().getRelatedId()).isEqualTo(1L);
        assertThat(saved.getValue().isRead()).isFalse();
    }

    @Test
    @DisplayName("An unreadable payload fails as an external collaborator error")
    void notificationDraft_Unreadable() {
        NotificationSideEffectHandler handler = new NotificationSideEffectHandler(notificationRepository, objectMapper);

        assertThatThrownBy(() -> handler.apply("{not json"))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.EXTERNAL_COLLABORATOR));
        then(notificationRepository).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("A workshop alert is e-mailed to the admin with the request summary")
    void workshopAlert_IsSent() throws Exception {
        WorkshopAlertSideEffectHandler handler = new WorkshopAlertSideEffectHandler(workshopAlertSender, objectMapper);
        WorkshopAlert alert = new WorkshopAlert(3L, "Highway Auto Care", "admin@highwayauto.example", 1L,
                "Car", "Maruti", null, "Flat Tire", "HIGH", "Sector 17", "Rear left tyre is flat");

        handler.apply(objectMapper.writeValueAsString(alert));

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        then(workshopAlertSender).should().send(eq("admin@highwayauto.example"),
                eq("New Service Request - Flat Tire (HIGH Priority)"), body.capture());
        assertThat(body.getValue()).contains("Request ID: 1").contains("Location: Sector 17");
    }

    @Test
    @DisplayName("A workshop without an admin e-mail is skipped")
    void workshopAlert_NoEmail() throws Exception {
        WorkshopAlertSideEffectHandler handler = new WorkshopAlertSideEffectHandler(workshopAlertSender, objectMapper);
        WorkshopAlert alert = new WorkshopAlert(3L, "Highway Auto Care", " ", 1L,
                "Car", null, null, "Flat Tire", "HIGH", "Sector 17", "Rear left tyre is flat");

        handler.apply(objectMapper.writeValueAsString(alert));

        then(workshopAlertSender).shouldHaveNoInteractions();
    }
}
