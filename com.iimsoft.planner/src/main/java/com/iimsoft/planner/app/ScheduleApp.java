package com.iimsoft.planner.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.iimsoft.planner.api.dto.ScheduleRequest;
import com.iimsoft.planner.api.dto.ScheduleResponse;
import com.iimsoft.planner.calendar.WorkCalendarConfig;
import com.iimsoft.planner.service.ScheduleOrchestrator;
import com.iimsoft.planner.service.ScheduleRequestService;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行排程：读 ScheduleRequest JSON，输出排程结果。
 *
 * 用法：ScheduleApp [--calendar work-calendar.json] [--summary] [--compact] [--out result.json] (request.json | -)
 * - '-' 从 stdin 读请求
 * - --calendar 指定日历配置文件，不指定时按 -Dwork.calendar / classpath / 默认值加载
 * - --summary 每个任务一行文本，不输出 JSON
 *
 * 退出码：0 成功；1 排程失败（例如循环依赖）；2 参数或请求无效。
 */
public class ScheduleApp {

    static final int EXIT_OK = 0;
    static final int EXIT_SCHEDULE_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "用法：ScheduleApp [--calendar 文件] [--summary] [--compact] [--out 文件] (request.json | -)";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ScheduleResponse response;
        try {
            ScheduleRequest request = readRequest(options.input, stdin);
            response = new ScheduleRequestService(new ScheduleOrchestrator(loadConfig(options.calendarFile)))
                    .schedule(request);
        } catch (IOException e) {
            err.println("读取失败：" + e.getMessage());
            return EXIT_USAGE;
        } catch (IllegalArgumentException e) {
            err.println("请求无效：" + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            String text = options.summary ? summary(response) : json(response, options.compact);
            if (options.outputFile == null) {
                out.println(text);
            } else {
                Files.writeString(options.outputFile, text + System.lineSeparator(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            err.println("写入失败：" + e.getMessage());
            return EXIT_USAGE;
        }

        if (response.error != null) {
            err.println("排程失败：" + response.error + " (" + response.errorMessage + ")");
            return EXIT_SCHEDULE_FAILED;
        }
        return EXIT_OK;
    }

    private static ScheduleRequest readRequest(String input, InputStream stdin) throws IOException {
        if ("-".equals(input)) {
            return MAPPER.readValue(stdin, ScheduleRequest.class);
        }
        Path path = Path.of(input);
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("请求文件不存在或是目录：" + path.toAbsolutePath());
        }
        return MAPPER.readValue(path.toFile(), ScheduleRequest.class);
    }

    private static WorkCalendarConfig loadConfig(Path calendarFile) throws IOException {
        if (calendarFile == null) {
            return WorkCalendarConfig.load();
        }
        return MAPPER.readValue(calendarFile.toFile(), WorkCalendarConfig.class).sanitized();
    }

    private static String json(ScheduleResponse response, boolean compact) throws IOException {
        ObjectWriter writer = compact ? MAPPER.writer() : MAPPER.writerWithDefaultPrettyPrinter();
        return writer.writeValueAsString(response);
    }

    static String summary(ScheduleResponse response) {
        StringBuilder sb = new StringBuilder();
        if (response.error != null) {
            return sb.append("error: ").append(response.error).toString();
        }
        for (ScheduleResponse.TaskResult t : response.tasks) {
            sb.append(t.critical ? "* " : "  ")
                    .append(t.taskId).append(' ')
                    .append(t.name == null ? "" : t.name).append(' ')
                    .append(t.startDate == null ? "?" : t.startDate).append("..")
                    .append(t.endDate == null ? "?" : t.endDate);
            if (t.employeeId != null) {
                sb.append(" @").append(t.employeeId);
            }
            sb.append(System.lineSeparator());
        }
        sb.append("calendar days: ").append(response.calendarDuration)
                .append(", warnings: ").append(response.warnings == null ? 0 : response.warnings.size());
        return sb.toString();
    }

    static final class Options {
        String input;
        Path outputFile;
        Path calendarFile;
        boolean summary;
        boolean compact;

        static Options parse(String[] args) {
            Options o = new Options();
            if (args == null) {
                args = new String[0];
            }
            for (int i = 0; i < args.length; i++) {
                String arg = args[i] == null ? "" : args[i].trim();
                switch (arg) {
                    case "--summary":
                        o.summary = true;
                        break;
                    case "--compact":
                        o.compact = true;
                        break;
                    case "--out":
                        o.outputFile = Path.of(valueOf(args, ++i, arg));
                        break;
                    case "--calendar":
                        o.calendarFile = Path.of(valueOf(args, ++i, arg));
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("未知参数：" + arg);
                        }
                        if (arg.isEmpty()) {
                            continue;
                        }
                        if (o.input != null) {
                            throw new IllegalArgumentException("只能指定一个请求文件：" + o.input + ", " + arg);
                        }
                        o.input = arg;
                }
            }
            if (o.input == null) {
                throw new IllegalArgumentException("缺少参数：ScheduleRequest JSON 文件路径，或 '-' 代表从 stdin 读取");
            }
            return o;
        }

        private static String valueOf(String[] args, int i, String flag) {
            if (i >= args.length || args[i] == null || args[i].isBlank()) {
                throw new IllegalArgumentException(flag + " 缺少取值");
            }
            return args[i].trim();
        }
    }
}
