package com.roadassist.request.service;

import com.roadassist.TestFixtures;
import com.roadassist.common.exception.BusinessException;
import com.roadassist.common.exception.ErrorCode;
import com.roadassist.common.exception.ErrorKind;
import com.roadassist.common.security.AccessPolicy;
import com.roadassist.common.security.AccessPolicy.RequestAccess;
import com.roadassist.common.security.Actor;
import com.roadassist.mechanic.entity.Availability;
import com.roadassist.mechanic.entity.Mechanic;
import com.roadassist.mechanic.repository.MechanicRepository;
import com.roadassist.mechanic.service.MechanicService;
import com.roadassist.notification.entity.NotificationType;
import com.roadassist.notification.service.NotificationDraft;
import com.roadassist.notification.service.NotificationFanout;
import com.roadassist.notification.service.RoomKeys;
import com.roadassist.notification.service.WorkshopAlert;
import com.roadassist.request.dto.CreateServiceRequest;
import com.roadassist.request.dto.RequestEvent;
import com.roadassist.request.dto.StatusChange;
import com.roadassist.request.entity.ServiceRequest;
import com.roadassist.request.entity.ServiceStatus;
import com.roadassist.request.entity.Urgency;
import com.roadassist.request.repository.ServiceRequestRepository;
import com.roadassist.update.service.ServiceUpdateLog;
import com.roadassist.workshop.entity.Workshop;
import com.roadassist.workshop.service.WorkshopService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

@ExtendWith(MockitoExtension.class)
class ServiceRequestServiceTest {

    private static final long CUSTOMER_ID = 10L;
    private static final long WORKSHOP_ID = 3L;
    private static final long ADMIN_ID = 30L;
    private static final long MECHANIC_ID = 7L;
    private static final long MECHANIC_USER_ID = 70L;

    @Mock
    private ServiceRequestRepository serviceRequestRepository;

    @Mock
    private MechanicRepository mechanicRepository;

    @Mock
    private MechanicService mechanicService;

    @Mock
    private WorkshopService workshopService;

    @Mock
    private ServiceUpdateLog serviceUpdateLog;

    @Mock
    private NotificationFanout notificationFanout;

    @Mock
    private RequestAccessResolver requestAccessResolver;

    @Spy
    private AccessPolicy accessPolicy = new AccessPolicy(false);

    @InjectMocks
    private ServiceRequestService serviceRequestService;

    private static CreateServiceRequest payload(Long workshopId) {
        return new CreateServiceRequest("Car", "Maruti", "Swift", "Flat Tire",
                "Rear left tyre is flat on the highway", Urgency.HIGH, "Sector 17, Chandigarh",
                30.7333, 76.7794, List.of("https://img.example/1.jpg"), workshopId);
    }

    private void givenSavedWithId(long id) {
        willAnswer(inv -> {
            ServiceRequest saved = inv.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", id);
            return saved;
        }).given(serviceRequestRepository).save(any(ServiceRequest.class));
    }

    private static ServiceRequest requestIn(ServiceStatus status) {
        if (status == ServiceStatus.CANCELLED) {
            ServiceRequest request = TestFixtures.request(1L, CUSTOMER_ID, WORKSHOP_ID);
            request.changeStatus(ServiceStatus.CANCELLED, LocalDateTime.now());
            return request;
        }
        ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
        for (ServiceStatus step : List.of(ServiceStatus.IN_PROGRESS, ServiceStatus.REACHED, ServiceStatus.COMPLETED)) {
            if (request.getStatus() == status) {
                break;
            }
            request.changeStatus(step, LocalDateTime.now());
        }
        return request;
    }

    private static RequestAccess assignedAccess() {
        return new RequestAccess(CUSTOMER_ID, MECHANIC_USER_ID, ADMIN_ID);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("An unrouted request is broadcast to the unassigned room and nobody gets an inbox entry")
        void createUnrouted_BroadcastsToUnassignedRoom() {
            // Given
            givenSavedWithId(1L);

            // When
            ServiceRequest created = serviceRequestService.create(payload(null), TestFixtures.customer(CUSTOMER_ID));

            // Then
            assertThat(created.getStatus()).isEqualTo(ServiceStatus.SUBMITTED);
            assertThat(created.getCustomerId()).isEqualTo(CUSTOMER_ID);
            assertThat(created.getWorkshopId()).isNull();
            assertThat(created.getMechanicId()).isNull();
            assertThat(created.getImages()).containsExactly("https://img.example/1.jpg");

            ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
            then(notificationFanout).should().push(eq(RoomKeys.UNASSIGNED_REQUESTS),
                    eq(ServiceRequestService.NEW_REQUEST_EVENT), event.capture());
            assertThat(((RequestEvent) event.getValue()).serviceRequest().id()).isEqualTo(1L);
            then(notificationFanout).should(never()).notify(any(NotificationDraft.class));
            then(notificationFanout).should(never()).alertWorkshop(any());
        }

        @Test
        @DisplayName("A request routed to a workshop notifies, pushes to and e-mails the workshop admin")
        void createRouted_NotifiesWorkshopAdmin() {
            // Given
            Workshop workshop = TestFixtures.workshop(WORKSHOP_ID, ADMIN_ID);
            given(workshopService.getWorkshop(WORKSHOP_ID)).willReturn(workshop);
            givenSavedWithId(2L);

            // When
            ServiceRequest created = serviceRequestService.create(payload(WORKSHOP_ID), TestFixtures.customer(CUSTOMER_ID));

            // Then
            assertThat(created.getWorkshopId()).isEqualTo(WORKSHOP_ID);

            ArgumentCaptor<NotificationDraft> draft = ArgumentCaptor.forClass(NotificationDraft.class);
            then(notificationFanout).should().notify(draft.capture());
            assertThat(draft.getValue().userId()).isEqualTo(ADMIN_ID);
            assertThat(draft.getValue().type()).isEqualTo(NotificationType.NEW_REQUEST);
            assertThat(draft.getValue().relatedId()).isEqualTo(2L);

            then(notificationFanout).should().push(eq(RoomKeys.user(ADMIN_ID)),
                    eq(ServiceRequestService.NEW_REQUEST_EVENT), any());
            then(notificationFanout).should(never()).push(eq(RoomKeys.UNASSIGNED_REQUESTS), anyString(), any());

            ArgumentCaptor<WorkshopAlert> alert = ArgumentCaptor.forClass(WorkshopAlert.class);
            then(notificationFanout).should().alertWorkshop(alert.capture());
            assertThat(alert.getValue().adminEmail()).isEqualTo("admin@highwayauto.example");
            assertThat(alert.getValue().subject()).isEqualTo("New Service Request - Flat Tire (HIGH Priority)");
        }

        @Test
        @DisplayName("An unknown workshop id fails before anything is saved")
        void createWithUnknownWorkshop_Fails() {
            // Given
            given(workshopService.getWorkshop(99L))
                    .willThrow(new BusinessException(ErrorCode.WORKSHOP_NOT_FOUND));

            // When & Then
            assertThatThrownBy(() -> serviceRequestService.create(payload(99L), TestFixtures.customer(CUSTOMER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
            then(serviceRequestRepository).should(never()).save(any());
        }

        @Test
        @DisplayName("A description shorter than ten characters is a validation error")
        void createWithShortDescription_Fails() {
            // Given
            CreateServiceRequest shortDescription = new CreateServiceRequest("Car", null, null, "Flat Tire",
                    "  flat  ", null, "Sector 17", 30.7, 76.7, null, null);

            // When & Then
            assertThatThrownBy(() -> serviceRequestService.create(shortDescription, TestFixtures.customer(CUSTOMER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
            then(serviceRequestRepository).should(never()).save(any());
        }

        @Test
        @DisplayName("Missing coordinates are a validation error")
        void createWithoutCoordinates_Fails() {
            CreateServiceRequest noCoordinates = new CreateServiceRequest("Car", null, null, "Flat Tire",
                    "Rear left tyre is flat", null, "Sector 17", null, 76.7, null, null);

            assertThatThrownBy(() -> serviceRequestService.create(noCoordinates, TestFixtures.customer(CUSTOMER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.INVALID_INPUT));
        }

        @Test
        @DisplayName("Only end users may submit requests")
        void createByMechanic_Denied() {
            assertThatThrownBy(() -> serviceRequestService.create(payload(null), TestFixtures.mechanicUser(MECHANIC_USER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED));
            then(serviceRequestRepository).should(never()).save(any());
        }
    }

    @Nested
    @DisplayName("transition")
    class Transition {

        @Test
        @DisplayName("The assigned mechanic starts the job: startedAt is set and the customer is told")
        void startJob_Success() {
            // Given
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());

            // When
            ServiceRequest result = serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.IN_PROGRESS),
                    TestFixtures.mechanicUser(MECHANIC_USER_ID));

            // Then
            assertThat(result.getStatus()).isEqualTo(ServiceStatus.IN_PROGRESS);
            assertThat(result.getStartedAt()).isNotNull();
            then(serviceRequestRepository).should().flush();

            ArgumentCaptor<NotificationDraft> draft = ArgumentCaptor.forClass(NotificationDraft.class);
            then(notificationFanout).should().notify(draft.capture());
            assertThat(draft.getValue().userId()).isEqualTo(CUSTOMER_ID);
            assertThat(draft.getValue().type()).isEqualTo(NotificationType.SERVICE_UPDATE);
            assertThat(draft.getValue().message()).isEqualTo("Your mechanic is on the way");
            then(notificationFanout).should().push(eq(RoomKeys.user(CUSTOMER_ID)),
                    eq(ServiceRequestService.STATUS_UPDATED_EVENT), any());
            then(serviceUpdateLog).should(never()).recordNote(anyLong(), anyString(), any());
        }

        @Test
        @DisplayName("Re-applying the current status is a no-op: no timestamp, cost or note change and no fanout")
        void repeatedStatus_IsNoOp() {
            // Given
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            LocalDateTime startedAt = LocalDateTime.now().minusMinutes(20);
            request.changeStatus(ServiceStatus.IN_PROGRESS, startedAt);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());
            StatusChange repeated = new StatusChange(ServiceStatus.IN_PROGRESS, "Still on the way",
                    BigDecimal.valueOf(300), BigDecimal.valueOf(350));

            // When
            ServiceRequest result = serviceRequestService.transition(1L, repeated,
                    TestFixtures.mechanicUser(MECHANIC_USER_ID));

            // Then
            assertThat(result.getStatus()).isEqualTo(ServiceStatus.IN_PROGRESS);
            assertThat(result.getStartedAt()).isEqualTo(startedAt);
            assertThat(result.getEstimatedCost()).isNull();
            assertThat(result.getActualCost()).isNull();
            then(serviceRequestRepository).should(never()).flush();
            then(serviceUpdateLog).should(never()).recordNote(anyLong(), anyString(), any());
            then(notificationFanout).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("Skipping a stage is a state conflict and leaves the request untouched")
        void skipStage_StateConflict() {
            // Given
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));

            // When & Then
            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.COMPLETED),
                    TestFixtures.mechanicUser(MECHANIC_USER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> {
                        BusinessException be = (BusinessException) e;
                        assertThat(be.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATUS_TRANSITION);
                        assertThat(be.getKind()).isEqualTo(ErrorKind.STATE_CONFLICT);
                    });
            assertThat(request.getStatus()).isEqualTo(ServiceStatus.ASSIGNED);
            then(notificationFanout).shouldHaveNoInteractions();
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "COMPLETED, SUBMITTED",
                "COMPLETED, ASSIGNED",
                "COMPLETED, IN_PROGRESS",
                "COMPLETED, REACHED",
                "COMPLETED, CANCELLED",
                "CANCELLED, SUBMITTED",
                "CANCELLED, ASSIGNED",
                "CANCELLED, IN_PROGRESS",
                "CANCELLED, REACHED",
                "CANCELLED, COMPLETED",
                "REACHED, ASSIGNED",
                "IN_PROGRESS, SUBMITTED"
        })
        @DisplayName("Every edge outside the table is a state conflict, even towards SUBMITTED or ASSIGNED")
        void invalidEdge_StateConflictBeforePermission(ServiceStatus from, ServiceStatus to) {
            // Given
            ServiceRequest request = requestIn(from);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));

            // When & Then
            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(to),
                    TestFixtures.mechanicUser(MECHANIC_USER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> {
                        BusinessException be = (BusinessException) e;
                        assertThat(be.getErrorCode()).isEqualTo(ErrorCode.INVALID_STATUS_TRANSITION);
                        assertThat(be.getKind()).isEqualTo(ErrorKind.STATE_CONFLICT);
                    });
            assertThat(request.getStatus()).isEqualTo(from);
            then(notificationFanout).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("ASSIGNED can only be reached through the assignment operation")
        void assignedThroughStatusUpdate_Denied() {
            ServiceRequest request = TestFixtures.request(1L, CUSTOMER_ID, null);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));

            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.ASSIGNED),
                    TestFixtures.superAdmin(1L)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED));
            assertThat(request.getStatus()).isEqualTo(ServiceStatus.SUBMITTED);
        }

        @Test
        @DisplayName("A mechanic other than the assigned one cannot advance the job")
        void otherMechanic_Denied() {
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());

            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.IN_PROGRESS),
                    TestFixtures.mechanicUser(71L)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getKind()).isEqualTo(ErrorKind.PERMISSION));
            assertThat(request.getStatus()).isEqualTo(ServiceStatus.ASSIGNED);
        }

        @Test
        @DisplayName("The customer cannot mark their own request as started")
        void customerStartsJob_Denied() {
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());

            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.IN_PROGRESS),
                    TestFixtures.customer(CUSTOMER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED));
        }

        @Test
        @DisplayName("Customer cancellation frees the mechanic and tells both sides")
        void customerCancelsAssigned_ReleasesMechanic() {
            // Given
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            Mechanic mechanic = TestFixtures.mechanic(MECHANIC_ID, MECHANIC_USER_ID, WORKSHOP_ID);
            mechanic.occupy();
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());
            given(mechanicRepository.findById(MECHANIC_ID)).willReturn(Optional.of(mechanic));

            // When
            serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.CANCELLED), TestFixtures.customer(CUSTOMER_ID));

            // Then
            assertThat(request.getStatus()).isEqualTo(ServiceStatus.CANCELLED);
            assertThat(mechanic.getAvailability()).isEqualTo(Availability.AVAILABLE);

            ArgumentCaptor<NotificationDraft> drafts = ArgumentCaptor.forClass(NotificationDraft.class);
            then(notificationFanout).should(times(2)).notify(drafts.capture());
            assertThat(drafts.getAllValues())
                    .extracting(NotificationDraft::userId, NotificationDraft::type)
                    .containsExactlyInAnyOrder(
                            tuple(CUSTOMER_ID, NotificationType.REQUEST_CANCELLED),
                            tuple(MECHANIC_USER_ID, NotificationType.REQUEST_CANCELLED));
            then(notificationFanout).should().push(eq(RoomKeys.mechanic(MECHANIC_ID)),
                    eq(ServiceRequestService.TASK_CANCELLED_EVENT), any());
        }

        @Test
        @DisplayName("Completing records the message as an update and frees the mechanic")
        void complete_RecordsNoteAndCosts() {
            // Given
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            request.changeStatus(ServiceStatus.IN_PROGRESS, LocalDateTime.now());
            request.changeStatus(ServiceStatus.REACHED, LocalDateTime.now());
            Mechanic mechanic = TestFixtures.mechanic(MECHANIC_ID, MECHANIC_USER_ID, WORKSHOP_ID);
            mechanic.occupy();
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());
            given(mechanicRepository.findById(MECHANIC_ID)).willReturn(Optional.of(mechanic));
            StatusChange change = new StatusChange(ServiceStatus.COMPLETED, "Tyre replaced", null, BigDecimal.valueOf(450));

            // When
            serviceRequestService.transition(1L, change, TestFixtures.mechanicUser(MECHANIC_USER_ID));

            // Then
            assertThat(request.getCompletedAt()).isNotNull();
            assertThat(request.getActualCost()).isEqualByComparingTo("450");
            assertThat(mechanic.isAvailable()).isTrue();
            then(serviceUpdateLog).should().recordNote(1L, "Tyre replaced", List.of());
            then(notificationFanout).should(never()).push(eq(RoomKeys.mechanic(MECHANIC_ID)), anyString(), any());
        }

        @Test
        @DisplayName("A lost optimistic lock on flush surfaces as a concurrent modification conflict")
        void concurrentModification() {
            ServiceRequest request = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(assignedAccess());
            willThrow(new ObjectOptimisticLockingFailureException(ServiceRequest.class, 1L))
                    .given(serviceRequestRepository).flush();

            assertThatThrownBy(() -> serviceRequestService.transition(1L, StatusChange.of(ServiceStatus.IN_PROGRESS),
                    TestFixtures.mechanicUser(MECHANIC_USER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                            .isEqualTo(ErrorCode.CONCURRENT_MODIFICATION));
            then(notificationFanout).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("Unknown request id is not found")
        void unknownRequest_NotFound() {
            given(serviceRequestRepository.findById(404L)).willReturn(Optional.empty());

            assertThatThrownBy(() -> serviceRequestService.transition(404L, StatusChange.of(ServiceStatus.CANCELLED),
                    TestFixtures.customer(CUSTOMER_ID)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                            .isEqualTo(ErrorCode.SERVICE_REQUEST_NOT_FOUND));
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        @DisplayName("Another customer cannot read the request")
        void getRequest_OtherCustomerDenied() {
            ServiceRequest request = TestFixtures.request(1L, CUSTOMER_ID, null);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(new RequestAccess(CUSTOMER_ID, null, null));

            assertThatThrownBy(() -> serviceRequestService.getRequest(1L, TestFixtures.customer(11L)))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED));
        }

        @Test
        @DisplayName("Any workshop admin can read an unrouted request")
        void getRequest_AdminSeesUnrouted() {
            ServiceRequest request = TestFixtures.request(1L, CUSTOMER_ID, null);
            given(serviceRequestRepository.findById(1L)).willReturn(Optional.of(request));
            given(requestAccessResolver.accessOf(request)).willReturn(new RequestAccess(CUSTOMER_ID, null, null));

            assertThat(serviceRequestService.getRequest(1L, TestFixtures.admin(ADMIN_ID))).isSameAs(request);
        }

        @Test
        @DisplayName("Workshop queue offsets are rounded down to a page of the requested size")
        void workshopQueue_Paging() {
            // Given
            given(workshopService.getWorkshopOfAdmin(ADMIN_ID)).willReturn(TestFixtures.workshop(WORKSHOP_ID, ADMIN_ID));
            given(serviceRequestRepository.findWorkshopQueueByStatus(WORKSHOP_ID, ServiceStatus.SUBMITTED, PageRequest.of(2, 20)))
                    .willReturn(List.of());

            // When
            List<ServiceRequest> queue = serviceRequestService.getWorkshopRequests(TestFixtures.admin(ADMIN_ID),
                    ServiceStatus.SUBMITTED, 20, 45);

            // Then
            assertThat(queue).isEmpty();
            then(serviceRequestRepository).should(never()).findWorkshopQueue(anyLong(), any());
        }

        @Test
        @DisplayName("Mechanics see only their own tasks in the queue, filtered by status")
        void workshopQueue_MechanicSeesOwnTasks() {
            // Given
            Actor mechanicActor = TestFixtures.mechanicUser(MECHANIC_USER_ID);
            ServiceRequest assigned = TestFixtures.assignedRequest(1L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            ServiceRequest started = TestFixtures.assignedRequest(2L, CUSTOMER_ID, WORKSHOP_ID, MECHANIC_ID);
            started.changeStatus(ServiceStatus.IN_PROGRESS, LocalDateTime.now());
            given(mechanicService.getMechanicOfUser(MECHANIC_USER_ID))
                    .willReturn(TestFixtures.mechanic(MECHANIC_ID, MECHANIC_USER_ID, WORKSHOP_ID));
            given(serviceRequestRepository.findByMechanicIdOrderByCreatedAtDesc(MECHANIC_ID))
                    .willReturn(List.of(started, assigned));

            // When
            List<ServiceRequest> queue = serviceRequestService.getWorkshopRequests(mechanicActor,
                    ServiceStatus.ASSIGNED, null, null);

            // Then
            assertThat(queue).containsExactly(assigned);
            then(workshopService).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("End users have no workshop queue")
        void workshopQueue_EndUserDenied() {
            assertThatThrownBy(() -> serviceRequestService.getWorkshopRequests(TestFixtures.customer(CUSTOMER_ID),
                    null, null, null))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.ACCESS_DENIED));
        }
    }
}
