package com.tracegraph.core.scanner;

/**
 * Model documents shared by scanner, pipeline and versioning tests.
 */
public final class Fixtures {

    /**
     * Requirements model with:
     * <ul>
     *   <li>REQ-1 (stereotype text) and REQ-1.1 (no text)</li>
     *   <li>an element named "1234" rejected by the name filter</li>
     *   <li>REQ-1.1 derived from REQ-1 through a DeriveReqt stereotype</li>
     *   <li>REQ-1.1 refining REQ-1 and an unknown element, classified by name</li>
     *   <li>a dependency whose client is a plain block</li>
     * </ul>
     */
    public static final String REQUIREMENTS_XMI = """
        <?xml version="1.0" encoding="UTF-8"?>
        <xmi:XMI xmlns:xmi="http://www.omg.org/spec/XMI/20131001"
                 xmlns:uml="http://www.omg.org/spec/UML/20131001"
                 xmlns:sysml="http://www.omg.org/spec/SysML/20181001/SysML">
          <uml:Model xmi:type="uml:Model" xmi:id="model" name="Cruise">
            <packagedElement xmi:type="uml:Class" xmi:id="_c1" name="Vehicle Speed Control">
              <ownedComment xmi:type="uml:Comment" xmi:id="_cm1" body="The vehicle shall hold the set speed."/>
            </packagedElement>
            <packagedElement xmi:type="uml:Class" xmi:id="_c2" name="Speed Sensor Accuracy"/>
            <packagedElement xmi:type="uml:Class" xmi:id="_c3" name="1234"/>
            <packagedElement xmi:type="uml:Class" xmi:id="_b1" name="Engine Block"/>
            <packagedElement xmi:type="uml:Abstraction" xmi:id="_d1" client="_c2" supplier="_c1"/>
            <packagedElement xmi:type="uml:Dependency" xmi:id="_d2" client="_b1" supplier="_c1"/>
            <packagedElement xmi:type="uml:Abstraction" xmi:id="_d3" name="refines speed" client="_c2" supplier="_c1 _missing"/>
          </uml:Model>
          <sysml:Requirement xmi:id="_s1" base_Class="_c1" id="REQ-1" text="Maintain speed within 1 km/h."/>
          <sysml:Requirement xmi:id="_s2" base_Class="_c2" id="REQ-1.1"/>
          <sysml:Requirement xmi:id="_s3" base_Class="_c3" id="REQ-9"/>
          <sysml:DeriveReqt xmi:id="_s4" base_Abstraction="_d1"/>
        </xmi:XMI>
        """;

    /** Root descriptor with two model-level properties. */
    public static final String BLOCK_DIAGRAM = """
        <?xml version="1.0" encoding="UTF-8"?>
        <ModelInformation>
          <Model Name="Plant">
            <P Name="SolverType">Fixed-step</P>
            <P Name="FixedStep">0.01</P>
          </Model>
        </ModelInformation>
        """;

    /** Root system: a gain feeding two outports through a branched line. */
    public static final String SYSTEM_ROOT = """
        <?xml version="1.0" encoding="UTF-8"?>
        <System>
          <Block BlockType="Gain" Name="K" SID="10">
            <PortCounts in="1" out="1"/>
            <P Name="Position">[100, 50, 130, 80]</P>
            <P Name="ZOrder">3</P>
            <P Name="Gain">2.5</P>
          </Block>
          <Block BlockType="Outport" Name="Out1" SID="20">
            <PortCounts in="1"/>
          </Block>
          <Block BlockType="Outport" Name="Out2" SID="30">
            <P Name="Position">[1, 2, 3]</P>
          </Block>
          <Line>
            <P Name="Name">speed</P>
            <P Name="Src">10#out:1</P>
            <Branch>
              <P Name="Dst">20#in:1</P>
            </Branch>
            <Branch>
              <P Name="Dst">30#in:1</P>
            </Branch>
          </Line>
        </System>
        """;

    private Fixtures() {
    }
}
