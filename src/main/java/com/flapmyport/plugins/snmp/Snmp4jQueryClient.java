package com.flapmyport.plugins.snmp;

import com.flapmyport.core.spi.SnmpQueryClient;
import com.flapmyport.core.spi.SnmpQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snmp4j.CommunityTarget;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.event.ResponseEvent;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.Address;
import org.snmp4j.smi.GenericAddress;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.Variable;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * SNMPv2c GET of one string value. Each call opens its own UDP transport and closes it
 * before returning, success or not.
 */
public class Snmp4jQueryClient implements SnmpQueryClient {
    private static final Logger log = LoggerFactory.getLogger(Snmp4jQueryClient.class);

    private final int port;
    private final long timeoutMs;
    private final int retries;

    public Snmp4jQueryClient(int port, long timeoutMs, int retries) {
        this.port = port;
        this.timeoutMs = timeoutMs;
        this.retries = retries;
    }

    @Override
    public String get(String oid, String targetAddress, String community) throws SnmpQueryException {
        Address address = GenericAddress.parse("udp:" + targetAddress + "/" + port);
        if (address == null) {
            throw new SnmpQueryException("invalid target address " + targetAddress);
        }

        CommunityTarget<Address> target = new CommunityTarget<>();
        target.setCommunity(new OctetString(community));
        target.setAddress(address);
        target.setVersion(SnmpConstants.version2c);
        target.setTimeout(timeoutMs);
        target.setRetries(retries);

        PDU pdu = new PDU();
        pdu.setType(PDU.GET);
        pdu.add(new VariableBinding(new OID(oid)));

        Snmp snmp = null;
        try {
            snmp = new Snmp(new DefaultUdpTransportMapping());
            snmp.listen();
            ResponseEvent<Address> event = snmp.send(pdu, target);
            return parse(oid, targetAddress, event);
        } catch (IOException e) {
            throw new SnmpQueryException("SNMP GET " + oid + " to " + targetAddress + " failed: " + e.getMessage(), e);
        } finally {
            if (snmp != null) {
                try {
                    snmp.close();
                } catch (IOException e) {
                    log.debug("error closing SNMP session to {}: {}", targetAddress, e.toString());
                }
            }
        }
    }

    static String parse(String oid, String targetAddress, ResponseEvent<?> event) throws SnmpQueryException {
        PDU response = event != null ? event.getResponse() : null;
        if (response == null) {
            Exception err = event != null ? event.getError() : null;
            throw new SnmpQueryException("no response from " + targetAddress + " for " + oid
                    + (err != null ? ": " + err.getMessage() : " (timeout)"), err);
        }
        if (response.getErrorStatus() != PDU.noError) {
            throw new SnmpQueryException(targetAddress + " returned " + response.getErrorStatusText() + " for " + oid);
        }
        if (response.size() == 0) {
            throw new SnmpQueryException("empty response from " + targetAddress + " for " + oid);
        }
        VariableBinding vb = response.get(0);
        if (vb.isException()) {
            throw new SnmpQueryException(targetAddress + " has no value for " + oid + ": " + vb.getVariable());
        }
        Variable value = vb.getVariable();
        if (!(value instanceof OctetString s)) {
            throw new SnmpQueryException("received " + (value == null ? "nil" : value.getSyntaxString())
                    + " instead of a string from " + targetAddress + " for " + oid);
        }
        return new String(s.getValue(), StandardCharsets.UTF_8);
    }
}
