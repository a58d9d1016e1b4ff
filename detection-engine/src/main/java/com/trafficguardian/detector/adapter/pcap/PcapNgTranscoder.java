package com.trafficguardian.detector.adapter.pcap;

import com.trafficguardian.detector.error.FormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-frames a pcapng capture as a classic microsecond libpcap capture so the
 * packet library can decode it.
 *
 * <p>
 * Only the block framing is handled here: section headers select the byte
 * order, interface descriptions give the link type and {@code if_tsresol},
 * enhanced and simple packet blocks become classic records. The output link
 * type is that of the first interface; packets captured on an interface with
 * a different link type are dropped.
 * </p>
 *
 * @author Naveed Gung
 */
final class PcapNgTranscoder {

    private static final Logger log = LoggerFactory.getLogger(PcapNgTranscoder.class);

    private static final int BYTE_ORDER_MAGIC = 0x1A2B3C4D;
    private static final int BLOCK_INTERFACE_DESCRIPTION = 1;
    private static final int BLOCK_SIMPLE_PACKET = 3;
    private static final int BLOCK_ENHANCED_PACKET = 6;
    private static final int OPTION_IF_TSRESOL = 9;
    private static final int LINKTYPE_ETHERNET = 1;

    private PcapNgTranscoder() {
    }

    static byte[] toClassic(byte[] data) {
        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        List<Interface> interfaces = new ArrayList<>();
        List<byte[]> records = new ArrayList<>();
        int outputLinkType = -1;
        long lastMicros = 0;
        int dropped = 0;

        try {
            while (buf.remaining() >= 12) {
                int blockStart = buf.position();
                int blockType = buf.getInt(blockStart);
                if (blockType == PcapReader.PCAPNG_SECTION_HEADER) {
                    buf.order(sectionOrder(buf.order(ByteOrder.BIG_ENDIAN).getInt(blockStart + 8)));
                    interfaces.clear();
                }
                int blockLength = buf.getInt(blockStart + 4);
                if (blockLength < 12 || blockLength > buf.limit() - blockStart) {
                    log.warn("Truncated pcapng block at offset {} (length {})", blockStart, blockLength);
                    break;
                }

                if (blockType == BLOCK_INTERFACE_DESCRIPTION) {
                    Interface iface = readInterface(buf, blockStart, blockLength);
                    interfaces.add(iface);
                    if (outputLinkType < 0) {
                        outputLinkType = iface.linkType();
                    }
                } else if (blockType == BLOCK_ENHANCED_PACKET || blockType == BLOCK_SIMPLE_PACKET) {
                    boolean enhanced = blockType == BLOCK_ENHANCED_PACKET;
                    int interfaceId = enhanced ? buf.getInt(blockStart + 8) : 0;
                    Interface iface = interfaceId < interfaces.size() ? interfaces.get(interfaceId) : Interface.DEFAULT;
                    if (outputLinkType < 0) {
                        outputLinkType = iface.linkType();
                    }
                    if (iface.linkType() != outputLinkType) {
                        dropped++;
                    } else if (enhanced) {
                        long ticks = (Integer.toUnsignedLong(buf.getInt(blockStart + 12)) << 32)
                                | Integer.toUnsignedLong(buf.getInt(blockStart + 16));
                        lastMicros = iface.toMicros(ticks);
                        int capturedLength = Math.min(buf.getInt(blockStart + 20), blockLength - 32);
                        int originalLength = buf.getInt(blockStart + 24);
                        records.add(record(buf, blockStart + 28, capturedLength, originalLength, lastMicros));
                    } else {
                        int originalLength = buf.getInt(blockStart + 8);
                        int capturedLength = Math.min(originalLength, blockLength - 16);
                        records.add(record(buf, blockStart + 12, capturedLength, originalLength, lastMicros));
                    }
                }
                buf.position(blockStart + blockLength);
            }
        } catch (BufferUnderflowException | IndexOutOfBoundsException e) {
            throw new FormatException("Truncated pcapng capture", e);
        }
        if (dropped > 0) {
            log.warn("Dropped {} pcapng packets captured on a link type other than {}", dropped, outputLinkType);
        }
        return classic(outputLinkType < 0 ? LINKTYPE_ETHERNET : outputLinkType, records);
    }

    private static ByteOrder sectionOrder(int byteOrderMagic) {
        if (byteOrderMagic == BYTE_ORDER_MAGIC) {
            return ByteOrder.BIG_ENDIAN;
        }
        if (Integer.reverseBytes(byteOrderMagic) == BYTE_ORDER_MAGIC) {
            return ByteOrder.LITTLE_ENDIAN;
        }
        throw new FormatException(String.format("Bad pcapng byte-order magic 0x%08X", byteOrderMagic));
    }

    private static Interface readInterface(ByteBuffer buf, int blockStart, int blockLength) {
        int linkType = Short.toUnsignedInt(buf.getShort(blockStart + 8));
        int optionsEnd = blockStart + blockLength - 4;
        int pos = blockStart + 16;
        byte resolution = 6;
        while (pos + 4 <= optionsEnd) {
            int code = Short.toUnsignedInt(buf.getShort(pos));
            int length = Short.toUnsignedInt(buf.getShort(pos + 2));
            if (code == 0) {
                break;
            }
            if (code == OPTION_IF_TSRESOL && length >= 1) {
                resolution = buf.get(pos + 4);
            }
            pos += 4 + ((length + 3) & ~3);
        }
        return new Interface(linkType, resolution);
    }

    private static byte[] record(ByteBuffer buf, int offset, int capturedLength, int originalLength, long micros) {
        int length = Math.max(0, capturedLength);
        ByteBuffer out = ByteBuffer.allocate(16 + length).order(ByteOrder.LITTLE_ENDIAN);
        out.putInt((int) (micros / 1_000_000L))
                .putInt((int) (micros % 1_000_000L))
                .putInt(length)
                .putInt(originalLength);
        byte[] frame = new byte[length];
        buf.get(offset, frame);
        out.put(frame);
        return out.array();
    }

    private static byte[] classic(int linkType, List<byte[]> records) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer header = ByteBuffer.allocate(24).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(PcapReader.MAGIC_MICROS).putShort((short) 2).putShort((short) 4)
                .putInt(0).putInt(0).putInt(262_144).putInt(linkType);
        out.writeBytes(header.array());
        for (byte[] record : records) {
            out.writeBytes(record);
        }
        return out.toByteArray();
    }

    /** Interface description from a pcapng section. */
    private record Interface(int linkType, byte resolution) {

        static final Interface DEFAULT = new Interface(LINKTYPE_ETHERNET, (byte) 6);

        long toMicros(long ticks) {
            if ((resolution & 0x80) != 0) {
                double seconds = ticks / Math.pow(2, resolution & 0x7F);
                return Math.round(seconds * 1e6);
            }
            if (resolution <= 6) {
                return ticks * (long) Math.pow(10, 6 - resolution);
            }
            return Long.divideUnsigned(ticks, (long) Math.pow(10, resolution - 6));
        }
    }
}
