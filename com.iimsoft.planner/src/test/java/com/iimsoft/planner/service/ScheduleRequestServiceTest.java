package com.iimsoft.planner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.planner.api.dto.ScheduleRequest;
import com.iimsoft.planner.api.dto.ScheduleResponse;
import com.iimsoft.planner.calendar.WorkCalendarConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleRequestServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ScheduleRequestService service;

    @BeforeEach
    void setUp() {
        service = new ScheduleRequestService(new ScheduleOrchestrator(WorkCalendarConfig.defaults()));
    }

    private ScheduleRequest read(String json) throws Exception {
        return mapper.readValue(json.replace('\'', '"'), ScheduleRequest.class);
    }

    @Test
    @DisplayName("前置字段三种写法都能识别")
    void mixedPredecessorEncodings() throws Exception {
        ScheduleRequest request = read("{"
                + "'project':{'id':1,'name':'Demo','startDate':'2025-01-06'},"
                + "'tasks':["
                + "  {'id':1,'name':'A','duration':3},"
                + "  {'id':2,'name':'B','duration':2,'predecessors':[1]},"
                + "  {'id':3,'name':'C','duration':1,'predecessors':'1'},"
                + "  {'id':4,'name':'D','duration':1,'predecessors':'[2, 3]'}"
                + "]}");

        ScheduleResponse response = service.schedule(request);

        assertNull(response.error);
        assertEquals(4, response.tasks.size());
        ScheduleResponse.TaskResult d = response.tasks.get(3);
        assertEquals("2025-01-11", d.startDate);
        assertEquals(1, d.durationCalendarDays);
        assertEquals(List.of(2L, 3L), response.dependencies.get(4L));
        assertEquals(List.of(1L, 2L, 4L), response.criticalChain);
        assertTrue(response.tasks.get(0).critical);
        assertEquals(6, response.calendarDuration);
    }

    @Test
    void personsEnableAssignment() throws Exception {
        ScheduleRequest request = read("{"
                + "'project':{'id':1,'startDate':'2025-01-10'},"
                + "'tasks':[{'id':1,'name':'Build','duration':5,'position':'Dev'}],"
                + "'persons':[{'id':7,'name':'Ann','position':'Dev','daysOff':'[6,7]'}]"
                + "}");

        ScheduleResponse response = service.schedule(request);

        ScheduleResponse.TaskResult build = response.tasks.get(0);
        assertEquals(7L, build.employeeId);
        assertEquals("2025-01-13", build.startDate);
        assertEquals("2025-01-17", build.endDate);
        assertEquals(5, response.workload.get(7L));
    }

    @Test
    void warningsAreSurfaced() throws Exception {
        ScheduleRequest request = read("{"
                + "'project':{'id':1,'startDate':'2025-01-06'},"
                + "'tasks':[{'id':1,'duration':2,'position':'Reviewer'},"
                + "         {'id':2,'duration':1,'predecessors':'not ids'}],"
                + "'persons':[{'id':7,'position':'Dev'}]"
                + "}");

        ScheduleResponse response = service.schedule(request);

        assertNull(response.tasks.get(0).employeeId);
        assertEquals("2025-01-06", response.tasks.get(0).startDate);
        List<String> codes = response.warnings.stream().map(w -> w.code).collect(java.util.stream.Collectors.toList());
        assertTrue(codes.contains("NO_ELIGIBLE_PERSON"));
        assertTrue(codes.contains("UNPARSEABLE_PREDECESSORS"));
    }

    @Test
    @DisplayName("原负责人不可用也没人替：响应里不再显示原负责人")
    void releasedAssigneeIsNotReported() throws Exception {
        ScheduleRequest request = read("{"
                + "'project':{'id':1,'startDate':'2025-01-06'},"
                + "'tasks':[{'id':1,'name':'Test','duration':3,'position':'QA','employeeId':7}],"
                + "'persons':[{'id':7,'name':'Ann','position':'Dev','daysOff':[3]}]"
                + "}");

        ScheduleResponse response = service.schedule(request);

        assertNull(response.tasks.get(0).employeeId);
        assertEquals("2025-01-06", response.tasks.get(0).startDate);
        assertEquals("2025-01-09", response.tasks.get(0).endDate);
    }

    @Test
    void cycleIsReportedAsErrorTag() throws Exception {
        ScheduleRequest request = read("{"
                + "'project':{'id':1,'startDate':'2025-01-06'},"
                + "'tasks':[{'id':1,'duration':1,'predecessors':[2]},{'id':2,'duration':1,'predecessors':[1]}]"
                + "}");

        ScheduleResponse response = service.schedule(request);

        assertEquals("cyclic dependency", response.error);
        assertTrue(response.criticalPath.isEmpty());
        assertNull(response.tasks.get(0).startDate);
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> service.schedule(new ScheduleRequest()));
        assertThrows(IllegalArgumentException.class,
                () -> service.schedule(read("{'project':{'id':1,'startDate':'06/01/2025'},'tasks':[]}")));
        assertThrows(IllegalArgumentException.class,
                () -> service.schedule(read("{'project':{'id':1,'startDate':'2025-01-06'}}")));
        assertThrows(IllegalArgumentException.class, () -> service.schedule(read("{"
                + "'project':{'id':1,'startDate':'2025-01-06'},'tasks':[],"
                + "'persons':[{'id':7},{'id':7}]}")));
    }

    @Test
    void emptyTaskListGivesEmptyResponse() throws Exception {
        ScheduleResponse response = service.schedule(read("{'project':{'id':1,'startDate':'2025-01-06'},'tasks':[]}"));
        assertNull(response.error);
        assertEquals(0, response.calendarDuration);
        assertTrue(response.tasks.isEmpty());
    }
}
