package com.trafficguardian.detector.adapter;

import com.trafficguardian.detector.traffic.TrafficRecord;
import com.trafficguardian.detector.traffic.TrafficTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class Iot23AdapterTest {

    @TempDir
    Path dir;

    @Test
    void shouldParseConnLogWithJoinedTrailingColumns() throws Exception {
        Path file = dir.resolve("conn.log.labeled");
        Files.writeString(file, String.join("\n",
                "#separator \\x09",
                "#fields\tts\tuid\tid.orig_h\tid.orig_p\tid.resp_h\tid.resp_p\tproto\tservice",
                "1525879831.015811\tCUmrqr4svHuSXJy5z7\t192.168.100.103\t51524\t65.127.233.163\t23\ttcp\t-"
                        + "\t2.999051\t0\t0\tS0\t-\t-\t0\tS\t3\t180\t0\t0"
                        + "\t-   Malicious   PartOfAHorizontalPortScan",
                "1525879832.5\tC2\t192.168.100.42\t38000\t8.8.8.8\t53\tudp\tdns"
                        + "\t0.1\t40\t80\tSF\t-\t-\t0\tDd\t1\t68\t1\t108"
                        + "\t-\tBenign\t-",
                "#close\t2018-05-09-20-00-00"));

        TrafficTable table = new Iot23Adapter().process(file);

        assertEquals(2, table.size());
        TrafficRecord scan = table.get(0);
        assertEquals(1_525_879_831L, scan.timestamp().getEpochSecond());
        assertEquals(103, scan.deviceId());
        assertEquals(51524, scan.srcPort());
        assertEquals("65.127.233.163", scan.dstIp());
        assertEquals(23, scan.dstPort());
        assertEquals(TrafficRecord.UNKNOWN, scan.service());
        assertEquals(2.999051, scan.duration(), 1e-9);
        assertEquals(3L, scan.packetSize());
        assertEquals("S0", scan.connState());
        assertEquals("Malicious", scan.label());
        assertEquals("PartOfAHorizontalPortScan", scan.attackType());

        TrafficRecord dns = table.get(1);
        assertEquals(42, dns.deviceId());
        assertEquals("dns", dns.service());
        assertEquals(2L, dns.packetSize());
        assertEquals(40L, dns.origBytes());
        assertEquals(80L, dns.respBytes());
        assertEquals("Benign", dns.label());
        assertEquals(TrafficRecord.NORMAL, dns.attackType());
    }

    @Test
    void shouldSplitSpaceJoinedTail() {
        String[] values = new String[21];
        Arrays.fill(values, "x");
        values[20] = "-   Malicious   C&C";

        String[] split = Iot23Adapter.splitJoinedTail(values);

        assertEquals(23, split.length);
        assertEquals("-", split[20]);
        assertEquals("Malicious", split[21]);
        assertEquals("C&C", split[22]);
    }

    @Test
    void shouldDeriveDeviceFromLastOctet() {
        assertEquals(42, Iot23Adapter.deviceIdFromAddress("192.168.1.42"));
        assertEquals(0, Iot23Adapter.deviceIdFromAddress("fe80::1"));
        assertEquals(0, Iot23Adapter.deviceIdFromAddress(null));
    }
}
